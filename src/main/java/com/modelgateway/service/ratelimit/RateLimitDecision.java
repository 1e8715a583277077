package com.modelgateway.service.ratelimit;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Result of a rate limit check: allowed, or denied with the wait until enough
 * tokens will have accrued.
 */
@Value
@Builder
public class RateLimitDecision {

    boolean allowed;

    /**
     * Tokens left in the bucket after the check.
     */
    double remainingTokens;

    /**
     * Wait before the same request could succeed. Null when allowed, and null
     * when the request exceeds the bucket capacity and can never succeed.
     */
    Duration retryAfter;

    String reason;

    public static RateLimitDecision allowed(double remainingTokens) {
        return RateLimitDecision.builder()
                .allowed(true)
                .remainingTokens(remainingTokens)
                .build();
    }

    public static RateLimitDecision denied(double remainingTokens, Duration retryAfter, String reason) {
        return RateLimitDecision.builder()
                .allowed(false)
                .remainingTokens(remainingTokens)
                .retryAfter(retryAfter)
                .reason(reason)
                .build();
    }
}
