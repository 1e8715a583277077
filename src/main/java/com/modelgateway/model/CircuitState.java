package com.modelgateway.model;

/**
 * Per-provider circuit breaker state.
 *
 * - CLOSED: all calls permitted
 * - OPEN: all calls short-circuited until the cooldown elapses
 * - HALF_OPEN: a single probe call is permitted
 * - RECOVERING: full traffic, but any failure reopens the circuit
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN,
    RECOVERING
}
