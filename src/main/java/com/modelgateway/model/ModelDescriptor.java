package com.modelgateway.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * One (provider, model) pair in the catalog.
 *
 * Immutable; a registry reload replaces the whole catalog rather than
 * mutating descriptors in place.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelDescriptor {

    String id;

    String provider;

    @Singular
    Set<Capability> capabilities;

    /**
     * USD per 1,000 input tokens.
     */
    double inputCostPer1k;

    /**
     * USD per 1,000 output tokens.
     */
    double outputCostPer1k;

    int maxContextTokens;

    @Builder.Default
    LatencyClass latencyClass = LatencyClass.STANDARD;

    @Builder.Default
    boolean enabled = true;

    /**
     * Regions the model is hosted in. Empty means unrestricted.
     */
    @Singular
    Set<String> regions;

    /**
     * Relative quality per task dimension ("reasoning", "coding", ...), 0 to 1.
     */
    @Singular
    Map<String, Double> qualityScores;

    public boolean supports(Collection<Capability> required) {
        return capabilities.containsAll(required);
    }

    public boolean fitsContext(int totalTokens) {
        return totalTokens <= maxContextTokens;
    }

    public boolean servesAnyRegion(Collection<String> allowedRegions) {
        if (allowedRegions == null || allowedRegions.isEmpty() || regions.isEmpty()) {
            return true;
        }
        return allowedRegions.stream().anyMatch(regions::contains);
    }

    /**
     * Quality score for {@code dimension}, 0 when the catalog declares none.
     */
    public double qualityScore(String dimension) {
        return qualityScores.getOrDefault(dimension, 0.0);
    }

    /**
     * Estimated cost in USD for the given token counts.
     */
    public double estimateCost(int inputTokens, int outputTokens) {
        return inputTokens / 1000.0 * inputCostPer1k + outputTokens / 1000.0 * outputCostPer1k;
    }
}
