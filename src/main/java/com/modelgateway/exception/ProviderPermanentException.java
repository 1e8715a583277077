package com.modelgateway.exception;

public class ProviderPermanentException extends GatewayException {

    public ProviderPermanentException(String message, Throwable cause) {
        super(GatewayErrorCode.PROVIDER_PERMANENT, message, cause);
    }
}
