package com.modelgateway.model.payload;

import com.modelgateway.model.Capability;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Request to embed one or more input strings.
 */
@Value
@Builder
@Jacksonized
public class EmbeddingPayload implements RequestPayload {

    @Singular
    List<String> inputs;

    @Override
    public String kind() {
        return "embedding";
    }

    @Override
    public String normalizedText() {
        return inputs.stream()
                .map(RequestPayload::normalize)
                .collect(Collectors.joining("\n"));
    }

    @Override
    public Set<Capability> impliedCapabilities() {
        return Set.of(Capability.EMBEDDINGS);
    }
}
