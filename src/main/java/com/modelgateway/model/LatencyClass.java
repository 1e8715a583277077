package com.modelgateway.model;

import java.time.Duration;

/**
 * Declared latency tier of a model. Ordinal order is the ranking order
 * (FAST sorts before STANDARD before SLOW).
 */
public enum LatencyClass {
    FAST(Duration.ofSeconds(2)),
    STANDARD(Duration.ofSeconds(10)),
    SLOW(Duration.ofSeconds(60));

    private final Duration nominalLatency;

    LatencyClass(Duration nominalLatency) {
        this.nominalLatency = nominalLatency;
    }

    /**
     * Typical upper bound for a response from a model in this tier.
     */
    public Duration getNominalLatency() {
        return nominalLatency;
    }
}
