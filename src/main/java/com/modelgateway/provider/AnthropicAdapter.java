package com.modelgateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelgateway.config.GatewayProperties;
import com.modelgateway.model.InferenceResult;
import com.modelgateway.model.ModelDescriptor;
import com.modelgateway.model.payload.ChatPayload;
import com.modelgateway.model.payload.Message;
import com.modelgateway.model.payload.RequestPayload;
import com.modelgateway.model.payload.VisionPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Anthropic (Claude) provider.
 * Supports chat and vision through the Messages API.
 */
@Slf4j
@Component
public class AnthropicAdapter extends AbstractProviderAdapter {

    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final ObjectMapper objectMapper;

    public AnthropicAdapter(WebClient webClient, GatewayProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, "anthropic");
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "anthropic";
    }

    @Override
    public Mono<InferenceResult> invoke(ModelDescriptor model, RequestPayload payload, int maxOutputTokens, Duration timeout) {
        if (!isEnabled()) {
            return notEnabled();
        }

        ObjectNode body;
        if (payload instanceof ChatPayload) {
            body = buildChatRequest(model, (ChatPayload) payload, maxOutputTokens);
        } else if (payload instanceof VisionPayload) {
            body = buildVisionRequest(model, (VisionPayload) payload, maxOutputTokens);
        } else {
            return Mono.error(unsupported(payload));
        }

        log.info("Forwarding {} request to Anthropic: model={}", payload.kind(), model.getId());

        Mono<InferenceResult> response = webClient.post()
                .uri(config.getBaseUrl() + "/v1/messages")
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body.toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(json -> toResult(model, payload, json));

        return execute(response, timeout);
    }

    /**
     * System messages move to the top-level "system" field; the rest become
     * content-block messages.
     */
    ObjectNode buildChatRequest(ModelDescriptor model, ChatPayload payload, int maxOutputTokens) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model.getId());
        request.put("max_tokens", maxOutputTokens);

        ArrayNode messages = request.putArray("messages");
        for (Message msg : payload.getMessages()) {
            if ("system".equals(msg.getRole())) {
                continue;
            }
            ObjectNode message = messages.addObject();
            message.put("role", msg.getRole());
            message.putArray("content").addObject()
                    .put("type", "text")
                    .put("text", msg.getContent());
        }

        String system = payload.systemPrompt();
        if (system != null) {
            request.put("system", system);
        }
        if (payload.getTemperature() != null) {
            request.put("temperature", payload.getTemperature());
        }
        return request;
    }

    private ObjectNode buildVisionRequest(ModelDescriptor model, VisionPayload payload, int maxOutputTokens) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model.getId());
        request.put("max_tokens", maxOutputTokens);

        ObjectNode message = request.putArray("messages").addObject();
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        for (String url : payload.getImageUrls()) {
            content.addObject()
                    .put("type", "image")
                    .putObject("source")
                    .put("type", "url")
                    .put("url", url);
        }
        content.addObject().put("type", "text").put("text", payload.getPrompt());
        return request;
    }

    InferenceResult toResult(ModelDescriptor model, RequestPayload payload, JsonNode response) {
        StringBuilder output = new StringBuilder();
        for (JsonNode item : response.path("content")) {
            if ("text".equals(item.path("type").asText())) {
                output.append(item.path("text").asText());
            }
        }

        JsonNode usage = response.path("usage");
        return InferenceResult.builder()
                .modelId(model.getId())
                .provider(getName())
                .output(output.toString())
                .inputTokens(usage.path("input_tokens").asInt(payload.estimateTokens()))
                .outputTokens(usage.path("output_tokens").asInt(estimateOutputTokens(output.toString())))
                .build();
    }
}
