package com.modelgateway.model.dto;

import com.modelgateway.model.CircuitState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of one provider's circuit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitStatus {

    private String provider;
    private CircuitState state;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private Instant lastTransition;
    private Instant nextProbeEligible;
    private Duration currentCooldown;
    private Duration timeUntilRetry;
    private long totalFailures;
    private long totalSuccesses;
}
