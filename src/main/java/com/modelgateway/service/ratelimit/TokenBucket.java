package com.modelgateway.service.ratelimit;

import com.modelgateway.model.dto.BucketState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Thread-safe token bucket.
 *
 * <p>
 * Starts full with {@code capacity} tokens and refills continuously at
 * {@code refillPerSecond}, never above capacity. Refill is computed lazily on
 * every call from the time elapsed since the last refill, so an idle bucket
 * costs nothing. Calls never block: a denial reports how long the caller would
 * have to wait.
 */
public class TokenBucket {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final long capacity;
    private final double refillPerSecond;
    private final Clock clock;

    private double tokens;
    private Instant lastRefill;

    public TokenBucket(long capacity, double refillPerSecond, Clock clock) {
        if (capacity <= 0 || refillPerSecond <= 0) {
            throw new IllegalArgumentException("Capacity and refill rate must be positive");
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefill = clock.instant();
    }

    /**
     * Try to take {@code numTokens} tokens.
     */
    public synchronized RateLimitDecision tryConsume(long numTokens) {
        RateLimitDecision decision = check(numTokens);
        if (decision.isAllowed()) {
            tokens -= numTokens;
            return RateLimitDecision.allowed(tokens);
        }
        return decision;
    }

    /**
     * Same verdict {@link #tryConsume(long)} would give right now, without taking tokens.
     */
    public synchronized RateLimitDecision peek(long numTokens) {
        return check(numTokens);
    }

    private RateLimitDecision check(long numTokens) {
        refill();

        if (numTokens > capacity) {
            return RateLimitDecision.denied(tokens, null, "Request of " + numTokens
                    + " tokens exceeds bucket capacity " + capacity);
        }
        if (tokens >= numTokens) {
            return RateLimitDecision.allowed(tokens);
        }
        return RateLimitDecision.denied(tokens, waitFor(numTokens - tokens), "Rate limit exceeded");
    }

    public synchronized BucketState getState(String caller, String provider) {
        refill();
        return BucketState.builder()
                .caller(caller)
                .provider(provider)
                .tokens(tokens)
                .capacity(capacity)
                .refillPerSecond(refillPerSecond)
                .occupancy(1.0 - tokens / capacity)
                .lastRefill(lastRefill)
                .build();
    }

    public long getCapacity() {
        return capacity;
    }

    public double getRefillPerSecond() {
        return refillPerSecond;
    }

    private void refill() {
        Instant now = clock.instant();
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();

        if (elapsedNanos <= 0) {
            return;
        }

        tokens = Math.min(capacity, tokens + elapsedNanos * refillPerSecond / NANOS_PER_SECOND);
        lastRefill = now;
    }

    private Duration waitFor(double deficit) {
        long nanos = (long) Math.ceil(deficit / refillPerSecond * NANOS_PER_SECOND);
        return Duration.ofNanos(nanos);
    }
}
