package com.modelgateway.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Semantic cache statistics for the admin surface.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Live entries currently indexed.
     */
    private long entries;

    private long hits;

    /**
     * Hits served by exact fingerprint match, a subset of {@link #hits}.
     */
    private long exactHits;

    private long misses;

    /**
     * Cache hit rate (0.0-1.0).
     */
    private double hitRate;

    private long stores;

    /**
     * Entries removed for capacity.
     */
    private long evictions;

    /**
     * Entries removed because their TTL elapsed.
     */
    private long expirations;

    private long embeddingFailures;

    /**
     * Live entries per capability partition.
     */
    private Map<String, Long> entriesByCapabilities;
}
