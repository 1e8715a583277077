package com.modelgateway.exception;

/**
 * Base class for every failure the gateway reports to its callers.
 */
public abstract class GatewayException extends RuntimeException {

    private final GatewayErrorCode code;

    protected GatewayException(GatewayErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected GatewayException(GatewayErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public GatewayErrorCode getCode() {
        return code;
    }
}
