package com.modelgateway.service.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.modelgateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Remote embeddings from an Ollama server ({@code POST /api/embeddings}).
 *
 * Target: bounded by {@code gateway.embedding.timeout} so a slow embedder can
 * never stall the request pipeline.
 *
 * {@link #embed(String)} blocks and must not be called from a non-blocking
 * (event loop or parallel) thread.
 */
@Slf4j
public class OllamaEmbeddingService implements EmbeddingService {

    private final WebClient webClient;
    private final GatewayProperties.EmbeddingConfig config;

    public OllamaEmbeddingService(WebClient webClient, GatewayProperties.EmbeddingConfig config) {
        this.webClient = webClient;
        this.config = config;
        log.info("Using Ollama embeddings: model={}, url={}", config.getModel(), config.getBaseUrl());
    }

    @Override
    public float[] embed(String text) {
        JsonNode response;
        try {
            response = webClient.post()
                    .uri(config.getBaseUrl() + "/api/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("model", config.getModel(), "prompt", text))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(config.getTimeout());
        } catch (RuntimeException e) {
            throw new EmbeddingException("Ollama embedding request failed: " + e.getMessage(), e);
        }

        JsonNode values = response == null ? null : response.get("embedding");
        if (values == null || !values.isArray() || values.isEmpty()) {
            throw new EmbeddingException("Ollama returned no embedding");
        }

        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) values.get(i).asDouble();
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return config.getDimensions();
    }

    @Override
    public String modelName() {
        return config.getModel();
    }

    @Override
    public boolean isReady() {
        return config.getBaseUrl() != null;
    }
}
