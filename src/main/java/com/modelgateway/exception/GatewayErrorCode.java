package com.modelgateway.exception;

/**
 * Error taxonomy surfaced to callers of the gateway.
 */
public enum GatewayErrorCode {
    /** No catalog entry satisfies the required capabilities or constraints. Not retried. */
    CAPABILITY_UNAVAILABLE,
    /** Every candidate was excluded by the circuit breaker or rate limiter. Retry later. */
    ALL_PROVIDERS_UNAVAILABLE,
    /** Transient provider failure that survived failover. */
    PROVIDER_TRANSIENT,
    /** Caller-side problem reported by the provider. Not retried. */
    PROVIDER_PERMANENT,
    /** Admission queue is full. */
    QUEUE_REJECTED,
    /** Deadline passed before the request could be served. */
    REQUEST_EXPIRED,
    MODEL_NOT_FOUND,
    INVALID_CATALOG,
    INVALID_REQUEST
}
