package com.modelgateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgateway.provider.ProviderAdapterRegistry;
import com.modelgateway.service.cache.RequestFingerprinter;
import com.modelgateway.service.cache.SemanticCache;
import com.modelgateway.service.circuit.CircuitBreaker;
import com.modelgateway.service.embedding.EmbeddingService;
import com.modelgateway.service.embedding.HashingEmbeddingService;
import com.modelgateway.service.embedding.OllamaEmbeddingService;
import com.modelgateway.service.queue.RequestQueue;
import com.modelgateway.service.ratelimit.RateLimiter;
import com.modelgateway.service.registry.CatalogSource;
import com.modelgateway.service.registry.JsonFileCatalogSource;
import com.modelgateway.service.registry.ModelRegistry;
import com.modelgateway.service.registry.PropertiesCatalogSource;
import com.modelgateway.service.routing.FailoverExecutor;
import com.modelgateway.service.routing.Router;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Core wiring shared by the stateful gateway components.
 */
@Slf4j
@Configuration
public class GatewayConfiguration {

    private final GatewayProperties properties;

    public GatewayConfiguration(GatewayProperties properties) {
        this.properties = properties;
    }

    /**
     * Single time source for breakers, buckets, cache TTLs and deadlines.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CatalogSource catalogSource(ObjectMapper objectMapper) {
        String location = properties.getCatalog().getLocation();
        if (location != null && !location.isBlank()) {
            return new JsonFileCatalogSource(Path.of(location), objectMapper);
        }
        return new PropertiesCatalogSource(properties);
    }

    @Bean
    public ModelRegistry modelRegistry(CatalogSource catalogSource, Clock clock) {
        ModelRegistry registry = new ModelRegistry(catalogSource, clock);
        registry.reload();
        return registry;
    }

    @Bean
    public RateLimiter rateLimiter(Clock clock) {
        return new RateLimiter(properties.getRateLimit(), clock);
    }

    @Bean
    public CircuitBreaker circuitBreaker(Clock clock) {
        return new CircuitBreaker(properties.getCircuitBreaker(), clock);
    }

    @Bean
    public EmbeddingService embeddingService(WebClient webClient) {
        GatewayProperties.EmbeddingConfig embedding = properties.getEmbedding();
        if ("ollama".equalsIgnoreCase(embedding.getProvider())) {
            return new OllamaEmbeddingService(webClient, embedding);
        }
        if (!"hashing".equalsIgnoreCase(embedding.getProvider())) {
            log.warn("Unknown embedding provider '{}', falling back to local hashing embeddings",
                    embedding.getProvider());
        }
        return new HashingEmbeddingService(embedding.getDimensions());
    }

    @Bean
    public SemanticCache semanticCache(EmbeddingService embeddingService, Clock clock) {
        return new SemanticCache(properties.getCache(), embeddingService, new RequestFingerprinter(), clock);
    }

    @Bean
    public Router router(ModelRegistry modelRegistry, CircuitBreaker circuitBreaker, RateLimiter rateLimiter) {
        return new Router(modelRegistry, circuitBreaker, rateLimiter, properties.getRouter());
    }

    @Bean
    public FailoverExecutor failoverExecutor(ProviderAdapterRegistry adapters,
                                             CircuitBreaker circuitBreaker,
                                             RateLimiter rateLimiter,
                                             Clock clock) {
        return new FailoverExecutor(adapters, circuitBreaker, rateLimiter, properties.getRouter(), clock);
    }

    @Bean
    public RequestQueue requestQueue(Clock clock) {
        return new RequestQueue(properties.getQueue(), clock);
    }
}
