package com.modelgateway.exception;

public class ModelNotFoundException extends GatewayException {

    public ModelNotFoundException(String modelId) {
        super(GatewayErrorCode.MODEL_NOT_FOUND, "Model not found: " + modelId);
    }
}
