package com.modelgateway.model.payload;

import com.modelgateway.model.Capability;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * Prompt over one or more images, referenced by URL or data URI.
 */
@Value
@Builder
@Jacksonized
public class VisionPayload implements RequestPayload {

    // Flat per-image charge, in tokens, added to the text estimate
    static final int TOKENS_PER_IMAGE = 765;

    String prompt;

    @Singular
    List<String> imageUrls;

    @Override
    public String kind() {
        return "vision";
    }

    @Override
    public String normalizedText() {
        StringBuilder text = new StringBuilder(RequestPayload.normalize(prompt));
        for (String url : imageUrls) {
            text.append("\nimage: ").append(url.trim());
        }
        return text.toString();
    }

    @Override
    public Set<Capability> impliedCapabilities() {
        return Set.of(Capability.VISION);
    }

    @Override
    public int estimateTokens() {
        int textTokens = Math.max(1, RequestPayload.normalize(prompt).length() / CHARS_PER_TOKEN);
        return textTokens + imageUrls.size() * TOKENS_PER_IMAGE;
    }
}
