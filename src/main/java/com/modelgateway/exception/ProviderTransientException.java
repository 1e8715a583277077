package com.modelgateway.exception;

/**
 * Transient provider failures exhausted the failover budget.
 */
public class ProviderTransientException extends GatewayException {

    private final int attempts;

    public ProviderTransientException(String message, int attempts, Throwable cause) {
        super(GatewayErrorCode.PROVIDER_TRANSIENT, message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
