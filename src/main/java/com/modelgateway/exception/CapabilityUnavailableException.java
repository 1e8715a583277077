package com.modelgateway.exception;

public class CapabilityUnavailableException extends GatewayException {

    public CapabilityUnavailableException(String message) {
        super(GatewayErrorCode.CAPABILITY_UNAVAILABLE, message);
    }
}
