package com.modelgateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelgateway.config.GatewayProperties;
import com.modelgateway.model.InferenceResult;
import com.modelgateway.model.ModelDescriptor;
import com.modelgateway.model.payload.ChatPayload;
import com.modelgateway.model.payload.EmbeddingPayload;
import com.modelgateway.model.payload.Message;
import com.modelgateway.model.payload.RequestPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Local Ollama server. Chat uses /api/chat without streaming; embeddings call
 * /api/embeddings once per input.
 */
@Slf4j
@Component
public class OllamaAdapter extends AbstractProviderAdapter {

    private final ObjectMapper objectMapper;

    public OllamaAdapter(WebClient webClient, GatewayProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, "ollama");
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "ollama";
    }

    @Override
    public Mono<InferenceResult> invoke(ModelDescriptor model, RequestPayload payload, int maxOutputTokens, Duration timeout) {
        if (!isEnabled()) {
            return notEnabled();
        }

        log.info("Forwarding {} request to Ollama: model={}", payload.kind(), model.getId());

        if (payload instanceof ChatPayload) {
            return execute(post("/api/chat", buildChatRequest(model, (ChatPayload) payload, maxOutputTokens))
                    .map(response -> toChatResult(model, payload, response)), timeout);
        }
        if (payload instanceof EmbeddingPayload) {
            return execute(embedAll(model, (EmbeddingPayload) payload), timeout);
        }
        return Mono.error(unsupported(payload));
    }

    private Mono<JsonNode> post(String path, ObjectNode body) {
        return webClient.post()
                .uri(config.getBaseUrl() + path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body.toString())
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    private ObjectNode buildChatRequest(ModelDescriptor model, ChatPayload payload, int maxOutputTokens) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model.getId());
        request.put("stream", false);

        ObjectNode options = request.putObject("options");
        options.put("num_predict", maxOutputTokens);
        if (payload.getTemperature() != null) {
            options.put("temperature", payload.getTemperature());
        }

        ArrayNode messages = request.putArray("messages");
        for (Message msg : payload.getMessages()) {
            messages.addObject()
                    .put("role", msg.getRole())
                    .put("content", msg.getContent());
        }
        return request;
    }

    private InferenceResult toChatResult(ModelDescriptor model, RequestPayload payload, JsonNode response) {
        String output = response.path("message").path("content").asText("");
        return InferenceResult.builder()
                .modelId(model.getId())
                .provider(getName())
                .output(output)
                .inputTokens(response.path("prompt_eval_count").asInt(payload.estimateTokens()))
                .outputTokens(response.path("eval_count").asInt(estimateOutputTokens(output)))
                .build();
    }

    private Mono<InferenceResult> embedAll(ModelDescriptor model, EmbeddingPayload payload) {
        return Flux.fromIterable(payload.getInputs())
                .concatMap(input -> {
                    ObjectNode request = objectMapper.createObjectNode();
                    request.put("model", model.getId());
                    request.put("prompt", input);
                    return post("/api/embeddings", request);
                })
                .map(response -> response.path("embedding"))
                .collectList()
                .map(vectors -> {
                    ArrayNode output = objectMapper.createArrayNode();
                    vectors.forEach(output::add);
                    return InferenceResult.builder()
                            .modelId(model.getId())
                            .provider(getName())
                            .output(output.toString())
                            .inputTokens(payload.estimateTokens())
                            .outputTokens(0)
                            .build();
                });
    }
}
