package com.modelgateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One increment of a streamed response. The last chunk of a stream has
 * {@code finalChunk} set, carries the finish reason and usually no content.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamChunk {

    String requestId;

    String modelId;

    String provider;

    int index;

    String contentDelta;

    boolean finalChunk;

    String finishReason;

    /**
     * Output tokens for the whole stream, when the provider reports them. Final chunk only.
     */
    Integer outputTokens;
}
