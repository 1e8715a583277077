package com.modelgateway.model;

import com.modelgateway.model.payload.RequestPayload;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * One unit of inference work.
 *
 * Never mutated after creation. Components that need to annotate a request
 * (for example stamping the enqueue time) derive a copy with {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class InferenceRequest {

    /**
     * Caller-supplied idempotency key.
     */
    String requestId;

    String callerId;

    @Singular
    Set<Capability> requiredCapabilities;

    RequestPayload payload;

    /**
     * Higher is more urgent.
     */
    @Builder.Default
    int priority = 0;

    /**
     * Upper bound on estimated cost in USD, or null for no bound.
     */
    Double maxCost;

    /**
     * Soft latency bound, or null for no bound.
     */
    Duration maxLatency;

    @Builder.Default
    int maxOutputTokens = 1024;

    /**
     * Absolute time after which the request is no longer worth serving, or null.
     */
    Instant deadline;

    Instant enqueueTime;

    @Builder.Default
    Volatility volatility = Volatility.STANDARD;

    @Singular
    Set<String> allowedRegions;

    @Builder.Default
    boolean cacheable = true;

    /**
     * Providers to favour. Ranked ahead of the others, or the only ones
     * considered under {@link RoutingStrategy#PROVIDER_PINNED}.
     */
    @Singular
    Set<String> preferredProviders;

    /**
     * Ranking override, or null for the gateway's default strategy.
     */
    RoutingStrategy strategy;

    /**
     * Quality dimension ranked on by {@link RoutingStrategy#QUALITY}, or null for "reasoning".
     */
    String qualityDimension;

    /**
     * Required capabilities plus those implied by the payload.
     */
    public Set<Capability> effectiveCapabilities() {
        Set<Capability> effective = EnumSet.noneOf(Capability.class);
        effective.addAll(requiredCapabilities);
        if (payload != null) {
            effective.addAll(payload.impliedCapabilities());
        }
        return effective;
    }

    public int estimatedInputTokens() {
        return payload == null ? 1 : payload.estimateTokens();
    }

    /**
     * Tokens charged against rate-limit buckets: input estimate plus the output budget.
     */
    public int estimatedTotalTokens() {
        return estimatedInputTokens() + maxOutputTokens;
    }

    public boolean isExpired(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }
}
