package com.modelgateway.model.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.modelgateway.model.Capability;

import java.util.Locale;
import java.util.Set;

/**
 * Inference payload, tagged by {@code kind}.
 *
 * The gateway never interprets the payload beyond its normalized text (for
 * fingerprinting and embedding), a token estimate (for cost, context and rate
 * limiting) and the capabilities the payload implies.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ChatPayload.class, name = "chat"),
        @JsonSubTypes.Type(value = EmbeddingPayload.class, name = "embedding"),
        @JsonSubTypes.Type(value = VisionPayload.class, name = "vision"),
        @JsonSubTypes.Type(value = OpaquePayload.class, name = "opaque")
})
public interface RequestPayload {

    int CHARS_PER_TOKEN = 4;

    /**
     * Payload kind name, as it appears in the {@code kind} discriminator.
     */
    String kind();

    /**
     * Whitespace-collapsed, lower-cased text used for fingerprints and embeddings.
     */
    String normalizedText();

    /**
     * Capabilities any model must have to serve this payload.
     */
    Set<Capability> impliedCapabilities();

    /**
     * Rough input token estimate (about four characters per token, never below one).
     */
    default int estimateTokens() {
        String text = normalizedText();
        if (text == null || text.isEmpty()) {
            return 1;
        }
        return Math.max(1, (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }
}
