package com.modelgateway.service.queue;

import com.modelgateway.model.InferenceRequest;
import com.modelgateway.model.InferenceResult;

import java.util.concurrent.CompletableFuture;

/**
 * A request waiting for a worker, with the future its caller is waiting on.
 */
public final class QueuedRequest {

    private final InferenceRequest request;
    private final CompletableFuture<InferenceResult> result = new CompletableFuture<>();

    public QueuedRequest(InferenceRequest request) {
        this.request = request;
    }

    public InferenceRequest getRequest() {
        return request;
    }

    public CompletableFuture<InferenceResult> getResult() {
        return result;
    }

    public String getCallerId() {
        return request.getCallerId() == null ? "" : request.getCallerId();
    }
}
