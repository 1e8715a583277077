package com.modelgateway.exception;

public class InvalidCatalogException extends GatewayException {

    public InvalidCatalogException(String message) {
        super(GatewayErrorCode.INVALID_CATALOG, message);
    }

    public InvalidCatalogException(String message, Throwable cause) {
        super(GatewayErrorCode.INVALID_CATALOG, message, cause);
    }
}
