package com.modelgateway.service.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.modelgateway.config.GatewayProperties;
import com.modelgateway.model.dto.BucketState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Per-(caller, provider) token bucket admission gate.
 *
 * <p>
 * Buckets are created lazily on first use and held in a Caffeine cache that
 * expires them after {@code gateway.rate-limit.idle-timeout} without access,
 * which bounds memory for callers that come and go. The cache is a concurrent
 * map and each bucket synchronizes on itself, so unrelated pairs never contend.
 *
 * <p>
 * Can be disabled via {@code gateway.rate-limit.enabled=false}.
 */
@Slf4j
public class RateLimiter {

    private final GatewayProperties.RateLimitConfig config;
    private final Clock clock;
    private final Cache<BucketKey, TokenBucket> buckets;

    public RateLimiter(GatewayProperties.RateLimitConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(config.getIdleTimeout())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Take {@code estimatedTokens} from the caller's bucket for the provider.
     */
    public RateLimitDecision tryAcquire(String caller, String provider, long estimatedTokens) {
        if (!config.isEnabled()) {
            return RateLimitDecision.allowed(Double.MAX_VALUE);
        }

        RateLimitDecision decision = resolveBucket(caller, provider).tryConsume(estimatedTokens);
        if (!decision.isAllowed()) {
            log.debug("Rate limit denied caller={} provider={} tokens={} retryAfter={}",
                    caller, provider, estimatedTokens, decision.getRetryAfter());
        }
        return decision;
    }

    /**
     * Non-consuming check: would {@link #tryAcquire} allow this right now?
     */
    public RateLimitDecision wouldAllow(String caller, String provider, long estimatedTokens) {
        if (!config.isEnabled()) {
            return RateLimitDecision.allowed(Double.MAX_VALUE);
        }
        TokenBucket bucket = buckets.getIfPresent(new BucketKey(caller, provider));
        if (bucket == null) {
            // A fresh bucket starts full
            long capacity = limitsFor(provider).getCapacity();
            return estimatedTokens <= capacity
                    ? RateLimitDecision.allowed(capacity)
                    : RateLimitDecision.denied(capacity, null, "Request exceeds bucket capacity " + capacity);
        }
        return bucket.peek(estimatedTokens);
    }

    /**
     * Occupancy of every live bucket, ordered by caller then provider.
     */
    public List<BucketState> getBucketStates() {
        buckets.cleanUp();
        return buckets.asMap().entrySet().stream()
                .map(entry -> entry.getValue().getState(entry.getKey().caller(), entry.getKey().provider()))
                .sorted(Comparator.comparing(BucketState::getCaller).thenComparing(BucketState::getProvider))
                .toList();
    }

    /**
     * Drop buckets idle for longer than the configured timeout.
     */
    public void evictIdle() {
        long before = buckets.estimatedSize();
        buckets.cleanUp();
        long evicted = before - buckets.estimatedSize();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate limit buckets", evicted);
        }
    }

    public long activeBuckets() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private TokenBucket resolveBucket(String caller, String provider) {
        return buckets.get(new BucketKey(caller, provider), key -> {
            GatewayProperties.BucketConfig limits = limitsFor(provider);
            log.debug("Created rate limit bucket caller={} provider={} capacity={} refill={}/s",
                    caller, provider, limits.getCapacity(), limits.getRefillPerSecond());
            return new TokenBucket(limits.getCapacity(), limits.getRefillPerSecond(), clock);
        });
    }

    private GatewayProperties.BucketConfig limitsFor(String provider) {
        GatewayProperties.BucketConfig override = config.getProviders().get(provider);
        if (override != null && override.getCapacity() > 0 && override.getRefillPerSecond() > 0) {
            return override;
        }
        GatewayProperties.BucketConfig defaults = new GatewayProperties.BucketConfig();
        defaults.setCapacity(config.getDefaultCapacity());
        defaults.setRefillPerSecond(config.getDefaultRefillPerSecond());
        return defaults;
    }

    private record BucketKey(String caller, String provider) {
    }
}
