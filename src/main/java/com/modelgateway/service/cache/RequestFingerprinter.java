package com.modelgateway.service.cache;

import com.modelgateway.model.Capability;
import com.modelgateway.model.InferenceRequest;
import com.modelgateway.model.payload.ChatPayload;
import com.modelgateway.model.payload.RequestPayload;
import org.apache.commons.codec.digest.DigestUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Canonical fingerprints for cache keys.
 *
 * Steps:
 * 1. Normalize payload text (lower case, collapsed whitespace)
 * 2. Sort capability names
 * 3. Round sampling temperature
 * 4. Generate SHA-256 hash
 *
 * Target: same logical request, same fingerprint.
 */
public class RequestFingerprinter {

    private static final int FLOAT_PRECISION = 2; // Round to 2 decimal places

    /**
     * SHA-256 over payload kind, capability set, parameters and normalized text.
     *
     * @return 64 hex chars
     */
    public String fingerprint(InferenceRequest request) {
        RequestPayload payload = request.getPayload();
        StringBuilder canonical = new StringBuilder()
                .append(payload == null ? "none" : payload.kind()).append('\n')
                .append(capabilityKey(request.effectiveCapabilities())).append('\n');

        if (payload instanceof ChatPayload) {
            Double temperature = ((ChatPayload) payload).getTemperature();
            if (temperature != null) {
                canonical.append("temperature=")
                        .append(BigDecimal.valueOf(temperature).setScale(FLOAT_PRECISION, RoundingMode.HALF_UP))
                        .append('\n');
            }
        }

        canonical.append(payload == null ? "" : payload.normalizedText());
        return DigestUtils.sha256Hex(canonical.toString());
    }

    /**
     * Order-independent key for a capability set, e.g. {@code CHAT,VISION}.
     */
    public static String capabilityKey(Collection<Capability> capabilities) {
        return capabilities.stream()
                .map(Capability::name)
                .sorted()
                .collect(Collectors.joining(","));
    }
}
