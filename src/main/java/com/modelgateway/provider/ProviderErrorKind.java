package com.modelgateway.provider;

/**
 * How a provider failure should be handled.
 *
 * - TRANSIENT: timeout, 5xx, throttling, connection reset. Counts against the
 *   provider's circuit and is eligible for failover.
 * - PERMANENT: auth failure, malformed request, content policy rejection.
 *   Caller-side; surfaced immediately, never retried, not a health signal.
 */
public enum ProviderErrorKind {
    TRANSIENT,
    PERMANENT
}
