package com.modelgateway.exception;

public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(GatewayErrorCode.INVALID_REQUEST, message);
    }
}
