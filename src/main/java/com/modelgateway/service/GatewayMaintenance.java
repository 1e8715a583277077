package com.modelgateway.service;

import com.modelgateway.config.GatewayProperties;
import com.modelgateway.service.cache.SemanticCache;
import com.modelgateway.service.queue.RequestQueue;
import com.modelgateway.service.ratelimit.RateLimiter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic housekeeping: cache TTL sweep, idle rate limit bucket eviction and
 * queued request expiry.
 */
@Slf4j
@Component
public class GatewayMaintenance {

    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final SemanticCache cache;
    private final RateLimiter rateLimiter;
    private final RequestQueue queue;
    private final GatewayProperties properties;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "gateway-maintenance");
        t.setDaemon(true);
        return t;
    });

    public GatewayMaintenance(SemanticCache cache, RateLimiter rateLimiter, RequestQueue queue,
                              GatewayProperties properties) {
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.queue = queue;
        this.properties = properties;
    }

    @PostConstruct
    void init() {
        schedule("cache sweep", cache::sweepExpired, properties.getCache().getSweepInterval());
        schedule("queue expiry", queue::sweepExpired, properties.getQueue().getSweepInterval());
        // Caffeine expires by access time; cleanUp just makes eviction prompt
        schedule("bucket eviction", rateLimiter::evictIdle, properties.getRateLimit().getIdleTimeout().dividedBy(2));
    }

    @PreDestroy
    void destroy() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void schedule(String name, Runnable task, Duration interval) {
        long millis = Math.max(1, interval.toMillis());
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Maintenance task '{}' failed", name, e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Scheduled {} every {}ms", name, millis);
    }
}
