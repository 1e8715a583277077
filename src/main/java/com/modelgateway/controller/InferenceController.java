package com.modelgateway.controller;

import com.modelgateway.exception.GatewayException;
import com.modelgateway.model.InferenceRequest;
import com.modelgateway.model.InferenceResult;
import com.modelgateway.service.ModelGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Inference endpoints: buffered responses with cache provenance headers, and
 * server-sent event streams.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class InferenceController {

    static final String HEADER_CACHE = "X-Gateway-Cache";
    static final String HEADER_MODEL = "X-Gateway-Model";
    static final String HEADER_SIMILARITY = "X-Gateway-Cache-Similarity";
    static final String EVENT_CHUNK = "chunk";
    static final String EVENT_ERROR = "error";

    private final ModelGateway gateway;

    public InferenceController(ModelGateway gateway) {
        this.gateway = gateway;
    }

    @PostMapping(value = "/inference", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<InferenceResult>> infer(@RequestBody InferenceRequest request) {
        log.info("Received inference request {} from {} (kind={}, priority={})",
                request.getRequestId(), request.getCallerId(),
                request.getPayload() == null ? "none" : request.getPayload().kind(), request.getPriority());

        return gateway.infer(request)
                .map(result -> {
                    ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                            .header(HEADER_CACHE, result.isCacheHit() ? "HIT" : "MISS")
                            .header(HEADER_MODEL, result.getModelId());
                    if (result.isCacheHit()) {
                        response.header(HEADER_SIMILARITY, String.format(Locale.ROOT, "%.4f", result.getCacheSimilarity()));
                    }
                    return response.body(result);
                });
    }

    /**
     * Stream a response as server-sent events. Each {@code chunk} event carries
     * a {@link com.modelgateway.model.StreamChunk}; a failure ends the stream
     * with a single {@code error} event carrying the error body.
     */
    @PostMapping(value = "/inference/stream",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> stream(@RequestBody InferenceRequest request) {
        log.info("Received streaming request {} from {} (kind={})",
                request.getRequestId(), request.getCallerId(),
                request.getPayload() == null ? "none" : request.getPayload().kind());

        return gateway.stream(request)
                .map(chunk -> ServerSentEvent.<Object>builder(chunk)
                        .id(String.valueOf(chunk.getIndex()))
                        .event(EVENT_CHUNK)
                        .build())
                .onErrorResume(GatewayException.class, ex -> Flux.just(
                        ServerSentEvent.<Object>builder(GatewayExceptionHandler.errorBody(ex))
                                .event(EVENT_ERROR)
                                .build()));
    }
}
