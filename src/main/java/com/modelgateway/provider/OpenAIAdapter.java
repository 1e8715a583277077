package com.modelgateway.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelgateway.config.GatewayProperties;
import com.modelgateway.model.InferenceResult;
import com.modelgateway.model.ModelDescriptor;
import com.modelgateway.model.StreamChunk;
import com.modelgateway.model.payload.ChatPayload;
import com.modelgateway.model.payload.EmbeddingPayload;
import com.modelgateway.model.payload.Message;
import com.modelgateway.model.payload.OpaquePayload;
import com.modelgateway.model.payload.RequestPayload;
import com.modelgateway.model.payload.VisionPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * OpenAI provider.
 * Chat and vision go to /chat/completions, embeddings to /embeddings. Opaque
 * payloads are forwarded verbatim to /chat/completions. Chat payloads stream
 * natively over server-sent events.
 */
@Slf4j
@Component
public class OpenAIAdapter extends AbstractProviderAdapter {

    private static final String STREAM_DONE = "[DONE]";

    private final ObjectMapper objectMapper;

    public OpenAIAdapter(WebClient webClient, GatewayProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, "openai");
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    public Mono<InferenceResult> invoke(ModelDescriptor model, RequestPayload payload, int maxOutputTokens, Duration timeout) {
        if (!isEnabled()) {
            return notEnabled();
        }

        log.info("Forwarding {} request to OpenAI: model={}", payload.kind(), model.getId());

        if (payload instanceof EmbeddingPayload) {
            return execute(post("/embeddings", buildEmbeddingRequest(model, (EmbeddingPayload) payload))
                    .map(response -> toEmbeddingResult(model, payload, response)), timeout);
        }

        Object body;
        if (payload instanceof ChatPayload) {
            body = buildChatRequest(model, (ChatPayload) payload, maxOutputTokens);
        } else if (payload instanceof VisionPayload) {
            body = buildVisionRequest(model, (VisionPayload) payload, maxOutputTokens);
        } else if (payload instanceof OpaquePayload) {
            body = ((OpaquePayload) payload).getData();
        } else {
            return Mono.error(unsupported(payload));
        }

        return execute(post("/chat/completions", body)
                .map(response -> toChatResult(model, payload, response)), timeout);
    }

    @Override
    public Flux<StreamChunk> stream(ModelDescriptor model, RequestPayload payload, int maxOutputTokens, Duration timeout) {
        if (!(payload instanceof ChatPayload)) {
            return super.stream(model, payload, maxOutputTokens, timeout);
        }
        if (!isEnabled()) {
            return this.<StreamChunk>notEnabled().flux();
        }

        log.info("Streaming chat request to OpenAI: model={}", model.getId());

        ObjectNode body = buildChatRequest(model, (ChatPayload) payload, maxOutputTokens);
        body.put("stream", true);
        body.putObject("stream_options").put("include_usage", true);

        // Per-subscription state: the final chunk reports what the stream carried
        Flux<StreamChunk> chunks = Flux.defer(() -> {
            AtomicInteger index = new AtomicInteger();
            AtomicReference<String> finishReason = new AtomicReference<>("stop");
            AtomicReference<Integer> outputTokens = new AtomicReference<>();

            return webClient.post()
                    .uri(config.getBaseUrl() + "/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToFlux(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                    })
                    .mapNotNull(ServerSentEvent::data)
                    .takeWhile(data -> !STREAM_DONE.equals(data))
                    .map(this::parseEvent)
                    .concatMapIterable(event -> {
                        JsonNode usage = event.path("usage");
                        if (usage.has("completion_tokens")) {
                            outputTokens.set(usage.get("completion_tokens").asInt());
                        }
                        JsonNode choice = event.path("choices").path(0);
                        if (choice.hasNonNull("finish_reason")) {
                            finishReason.set(choice.get("finish_reason").asText());
                        }
                        String delta = choice.path("delta").path("content").asText("");
                        if (delta.isEmpty()) {
                            return List.<StreamChunk>of();
                        }
                        return List.of(StreamChunk.builder()
                                .modelId(model.getId())
                                .provider(getName())
                                .index(index.getAndIncrement())
                                .contentDelta(delta)
                                .build());
                    })
                    .concatWith(Mono.fromSupplier(() -> StreamChunk.builder()
                            .modelId(model.getId())
                            .provider(getName())
                            .index(index.get())
                            .finalChunk(true)
                            .finishReason(finishReason.get())
                            .outputTokens(outputTokens.get())
                            .build()));
        });

        return executeStream(chunks, timeout);
    }

    private JsonNode parseEvent(String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw ProviderException.transientError(getName(), "Malformed OpenAI stream event: " + e.getOriginalMessage());
        }
    }

    private Mono<JsonNode> post(String path, Object body) {
        return webClient.post()
                .uri(config.getBaseUrl() + path)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    ObjectNode buildChatRequest(ModelDescriptor model, ChatPayload payload, int maxOutputTokens) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model.getId());
        request.put("max_tokens", maxOutputTokens);
        if (payload.getTemperature() != null) {
            request.put("temperature", payload.getTemperature());
        }

        ArrayNode messages = request.putArray("messages");
        for (Message msg : payload.getMessages()) {
            messages.addObject()
                    .put("role", msg.getRole())
                    .put("content", msg.getContent());
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
        content.addObject().put("type", "text").put("text", payload.getPrompt());
        for (String url : payload.getImageUrls()) {
            content.addObject()
                    .put("type", "image_url")
                    .putObject("image_url").put("url", url);
        }
        return request;
    }

    private ObjectNode buildEmbeddingRequest(ModelDescriptor model, EmbeddingPayload payload) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model.getId());
        ArrayNode input = request.putArray("input");
        payload.getInputs().forEach(input::add);
        return request;
    }

    InferenceResult toChatResult(ModelDescriptor model, RequestPayload payload, JsonNode response) {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw ProviderException.transientError(getName(), "OpenAI response has no choices");
        }
        String output = choices.get(0).path("message").path("content").asText("");

        JsonNode usage = response.path("usage");
        int inputTokens = usage.path("prompt_tokens").asInt(payload.estimateTokens());
        int outputTokens = usage.path("completion_tokens").asInt(estimateOutputTokens(output));

        return InferenceResult.builder()
                .modelId(model.getId())
                .provider(getName())
                .output(output)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .build();
    }

    private InferenceResult toEmbeddingResult(ModelDescriptor model, RequestPayload payload, JsonNode response) {
        ArrayNode vectors = objectMapper.createArrayNode();
        for (JsonNode item : response.path("data")) {
            vectors.add(item.path("embedding"));
        }

        return InferenceResult.builder()
                .modelId(model.getId())
                .provider(getName())
                .output(vectors.toString())
                .inputTokens(response.path("usage").path("prompt_tokens").asInt(payload.estimateTokens()))
                .outputTokens(0)
                .build();
    }
}
