package com.modelgateway.model.dto;

import com.modelgateway.model.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated gateway health. The summary endpoints only fill in
 * {@code status}, {@code timestamp} and {@code uptime}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {

    private HealthStatus status;
    private Instant timestamp;
    private Duration uptime;

    /**
     * Per-component status: registry, adapters, circuits, queue, cache.
     */
    private Map<String, ComponentHealth> components;

    private CatalogSummary catalog;
    private CacheStatistics cache;
    private QueueStatistics queue;
    private List<CircuitStatus> circuits;

    /**
     * Adapter name to {@code isEnabled()}.
     */
    private Map<String, Boolean> adapters;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ComponentHealth {
        private HealthStatus status;
        private String detail;
    }
}
