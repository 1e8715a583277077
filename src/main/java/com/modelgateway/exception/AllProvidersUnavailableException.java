package com.modelgateway.exception;

import java.time.Duration;

/**
 * Every capable candidate is currently excluded. Transient for the system:
 * {@link #getRetryAfter()} is the earliest time any candidate may become eligible.
 */
public class AllProvidersUnavailableException extends GatewayException {

    private final Duration retryAfter;

    public AllProvidersUnavailableException(String message, Duration retryAfter) {
        super(GatewayErrorCode.ALL_PROVIDERS_UNAVAILABLE, message);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
