package com.modelgateway.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Snapshot of one (caller, provider) rate limit bucket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BucketState {

    private String caller;
    private String provider;
    private double tokens;
    private long capacity;
    private double refillPerSecond;

    /**
     * Fraction of capacity currently spent (0.0-1.0).
     */
    private double occupancy;

    private Instant lastRefill;
}
