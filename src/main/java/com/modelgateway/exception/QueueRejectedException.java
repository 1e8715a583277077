package com.modelgateway.exception;

public class QueueRejectedException extends GatewayException {

    public QueueRejectedException(String message) {
        super(GatewayErrorCode.QUEUE_REJECTED, message);
    }
}
