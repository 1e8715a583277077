package com.modelgateway.model;

/**
 * Health of the gateway or one of its components, from best to worst.
 */
public enum HealthStatus {
    UP,
    DEGRADED,
    DOWN;

    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
