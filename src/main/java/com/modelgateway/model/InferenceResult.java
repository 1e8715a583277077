package com.modelgateway.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * Outcome of a served request. Produced once per request.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class InferenceResult {

    String requestId;

    String modelId;

    String provider;

    String output;

    int inputTokens;

    int outputTokens;

    double cost;

    Duration latency;

    boolean cacheHit;

    /**
     * Similarity of the matched cache entry; 0 when not served from cache.
     */
    double cacheSimilarity;

    public int getTokensConsumed() {
        return inputTokens + outputTokens;
    }
}
