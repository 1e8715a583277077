package com.modelgateway.provider;

import com.modelgateway.model.InferenceResult;
import com.modelgateway.model.ModelDescriptor;
import com.modelgateway.model.StreamChunk;
import com.modelgateway.model.payload.RequestPayload;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Uniform contract for performing inference against one provider.
 * Implementations handle provider-specific authentication, request/response
 * mapping, and API communication.
 */
public interface ProviderAdapter {

    /**
     * Provider name as used in the model catalog (e.g., "openai", "anthropic").
     *
     * @return provider name
     */
    String getName();

    /**
     * Run inference on {@code model}.
     *
     * The returned result carries the model, provider, output and token counts;
     * the caller fills in request id, cost and latency. Failures are signalled
     * as {@link ProviderException} with a transient or permanent kind.
     * Implementations must not retry.
     *
     * @param model           catalog entry to run on
     * @param payload         request payload
     * @param maxOutputTokens output budget
     * @param timeout         upper bound for the whole call
     */
    Mono<InferenceResult> invoke(ModelDescriptor model, RequestPayload payload, int maxOutputTokens, Duration timeout);

    /**
     * Run inference on {@code model}, emitting output as it is produced. The
     * last chunk has {@code finalChunk} set. Errors follow {@link #invoke}.
     *
     * The default replays the buffered {@link #invoke} result; adapters with
     * native streaming override it. For native streams {@code timeout} bounds
     * the wait for each chunk.
     */
    default Flux<StreamChunk> stream(ModelDescriptor model, RequestPayload payload, int maxOutputTokens, Duration timeout) {
        return invoke(model, payload, maxOutputTokens, timeout)
                .flatMapIterable(ResponseChunker::chunk);
    }

    /**
     * Check if provider is enabled and configured.
     *
     * @return true if ready to use
     */
    boolean isEnabled();
}
