package com.modelgateway.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Ranked candidates for one request. The first candidate is the primary;
 * the rest are failover targets in order.
 */
@Value
@Builder
public class RoutingDecision {

    @Singular
    List<ModelDescriptor> candidates;

    /**
     * Estimated cost of serving on the primary candidate.
     */
    double estimatedCost;

    RoutingStrategy strategy;

    /**
     * Model id to the reason it was excluded, for diagnostics.
     */
    @Singular
    Map<String, String> exclusions;

    public ModelDescriptor primary() {
        return candidates.get(0);
    }
}
