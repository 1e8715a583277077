package com.modelgateway.model.payload;

import com.modelgateway.model.Capability;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Set;

/**
 * Payload the gateway cannot interpret. Only its size and the capabilities the
 * caller declares for it are used.
 */
@Value
@Builder
@Jacksonized
public class OpaquePayload implements RequestPayload {

    byte[] data;

    @Singular
    Set<Capability> declaredCapabilities;

    @Override
    public String kind() {
        return "opaque";
    }

    /**
     * Opaque bytes have no meaningful text; the content digest stands in for it
     * so identical payloads still fingerprint identically.
     */
    @Override
    public String normalizedText() {
        return data == null ? "" : "sha256:" + DigestUtils.sha256Hex(data);
    }

    @Override
    public Set<Capability> impliedCapabilities() {
        return declaredCapabilities;
    }

    @Override
    public int estimateTokens() {
        int length = data == null ? 0 : data.length;
        return Math.max(1, (length + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }
}
