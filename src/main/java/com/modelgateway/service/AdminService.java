package com.modelgateway.service;

import com.modelgateway.model.dto.BucketState;
import com.modelgateway.model.dto.CacheStatistics;
import com.modelgateway.model.dto.CircuitStatus;
import com.modelgateway.model.dto.QueueStatistics;
import com.modelgateway.service.cache.SemanticCache;
import com.modelgateway.service.circuit.CircuitBreaker;
import com.modelgateway.service.queue.RequestQueue;
import com.modelgateway.service.ratelimit.RateLimiter;
import com.modelgateway.service.registry.CatalogSnapshot;
import com.modelgateway.service.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Admin service for introspection and operational controls.
 */
@Slf4j
@Service
public class AdminService {

    private final SemanticCache cache;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final RequestQueue queue;
    private final ModelRegistry registry;

    public AdminService(SemanticCache cache,
                        CircuitBreaker circuitBreaker,
                        RateLimiter rateLimiter,
                        RequestQueue queue,
                        ModelRegistry registry) {
        this.cache = cache;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.queue = queue;
        this.registry = registry;
    }

    public CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }

    /**
     * Drop every cached result.
     *
     * @return number of entries removed
     */
    public int clearCache() {
        int entries = cache.size();
        cache.clear();
        log.warn("Admin: cleared {} cache entries", entries);
        return entries;
    }

    /**
     * Status of every provider the catalog names, plus any the breaker has
     * seen that are no longer in the catalog.
     */
    public List<CircuitStatus> getCircuits() {
        registry.snapshot().providers().forEach(circuitBreaker::getStatus);
        return circuitBreaker.getStatuses();
    }

    public CircuitStatus resetCircuit(String provider) {
        log.warn("Admin: resetting circuit for provider {}", provider);
        circuitBreaker.reset(provider);
        return circuitBreaker.getStatus(provider);
    }

    public List<BucketState> getRateLimits() {
        return rateLimiter.getBucketStates();
    }

    public QueueStatistics getQueueStatistics() {
        return queue.statistics();
    }

    /**
     * Reload the catalog from its source. A failed reload keeps the current catalog.
     */
    public CatalogSnapshot reloadRegistry() {
        log.info("Admin: registry reload requested");
        return registry.reload();
    }
}
