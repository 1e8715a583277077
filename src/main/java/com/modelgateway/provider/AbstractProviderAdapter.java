package com.modelgateway.provider;

import com.modelgateway.config.GatewayProperties;
import com.modelgateway.model.payload.RequestPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Abstract base class for provider adapters with common functionality.
 */
@Slf4j
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    protected final WebClient webClient;
    protected final GatewayProperties.ProviderConfig config;

    protected AbstractProviderAdapter(WebClient webClient, GatewayProperties properties, String providerName) {
        this.webClient = webClient;
        this.config = properties.getProviders().get(providerName);
    }

    @Override
    public boolean isEnabled() {
        return config != null && config.isEnabled() && config.getBaseUrl() != null;
    }

    /**
     * Bound the call by the smaller of the request timeout and the provider's
     * configured timeout, and classify any failure.
     */
    protected <T> Mono<T> execute(Mono<T> request, Duration timeout) {
        return request
                .timeout(effectiveTimeout(timeout))
                .onErrorMap(error -> ProviderErrors.classify(getName(), error))
                .doOnError(error -> log.debug("Request failed for provider {}: {}", getName(), error.getMessage()));
    }

    /**
     * Streaming counterpart of {@link #execute(Mono, Duration)}: the timeout
     * bounds the wait for each element rather than the whole stream.
     */
    protected <T> Flux<T> executeStream(Flux<T> stream, Duration timeout) {
        return stream
                .timeout(effectiveTimeout(timeout))
                .onErrorMap(error -> ProviderErrors.classify(getName(), error))
                .doOnError(error -> log.debug("Stream failed for provider {}: {}", getName(), error.getMessage()));
    }

    protected <T> Mono<T> notEnabled() {
        return Mono.error(ProviderException.transientError(getName(), getName() + " provider is not enabled"));
    }

    private Duration effectiveTimeout(Duration timeout) {
        return config != null && config.getTimeout() != null && config.getTimeout().compareTo(timeout) < 0
                ? config.getTimeout()
                : timeout;
    }

    protected ProviderException unsupported(RequestPayload payload) {
        return ProviderException.permanentError(getName(),
                getName() + " does not support " + (payload == null ? "empty" : payload.kind()) + " payloads");
    }

    protected static int estimateOutputTokens(String output) {
        return output == null ? 0 : Math.max(1, output.length() / RequestPayload.CHARS_PER_TOKEN);
    }
}
