package com.modelgateway.service;

import com.modelgateway.MutableClock;
import com.modelgateway.config.GatewayProperties;
import com.modelgateway.exception.AllProvidersUnavailableException;
import com.modelgateway.exception.InvalidRequestException;
import com.modelgateway.exception.QueueRejectedException;
import com.modelgateway.exception.RequestExpiredException;
import com.modelgateway.model.Capability;
import com.modelgateway.model.InferenceRequest;
import com.modelgateway.model.InferenceResult;
import com.modelgateway.model.RoutingDecision;
import com.modelgateway.model.StreamChunk;
import com.modelgateway.model.payload.ChatPayload;
import com.modelgateway.model.payload.Message;
import com.modelgateway.service.cache.RequestFingerprinter;
import com.modelgateway.service.cache.SemanticCache;
import com.modelgateway.service.embedding.HashingEmbeddingService;
import com.modelgateway.service.embedding.OllamaEmbeddingService;
import com.modelgateway.service.queue.QueuedRequest;
import com.modelgateway.service.queue.RequestQueue;
import com.modelgateway.service.routing.FailoverExecutor;
import com.modelgateway.service.routing.Router;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for ModelGateway.
 */
class ModelGatewayTest {

    private MutableClock clock;
    private SemanticCache cache;
    private GatewayProperties.QueueConfig queueConfig;
    private RequestQueue queue;
    private Router router;
    private FailoverExecutor executor;
    private ModelGateway gateway;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new SemanticCache(new GatewayProperties.CacheConfig(),
                new HashingEmbeddingService(384), new RequestFingerprinter(), clock);
        queueConfig = new GatewayProperties.QueueConfig();
        queue = new RequestQueue(queueConfig, clock);
        router = mock(Router.class);
        executor = mock(FailoverExecutor.class);
        gateway = new ModelGateway(cache, queue, router, executor, clock);

        when(router.route(any())).thenReturn(RoutingDecision.builder().build());
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            InferenceRequest request = invocation.getArgument(0);
            return InferenceResult.builder()
                    .requestId(request.getRequestId())
                    .modelId("gpt-4o-mini")
                    .provider("openai")
                    .output("Paris")
                    .inputTokens(12)
                    .outputTokens(3)
                    .cost(0.002)
                    .latency(Duration.ofMillis(400))
                    .build();
        });
    }

    @Test
    void testMissIsRoutedThenServedFromCache() throws Exception {
        CompletableFuture<InferenceResult> first = gateway.submit(request("req-1", "What is the capital of France?"));
        assertFalse(first.isDone());
        runWorker();

        InferenceResult served = first.get();
        assertEquals("Paris", served.getOutput());
        assertFalse(served.isCacheHit());
        assertEquals(0.002, served.getCost(), 1e-9);

        InferenceResult cached = gateway.submit(request("req-2", "What is the capital of France?")).get();
        assertTrue(cached.isCacheHit());
        assertEquals("req-2", cached.getRequestId());
        assertEquals("Paris", cached.getOutput());
        assertEquals(0.0, cached.getCost());
        assertEquals(1.0, cached.getCacheSimilarity(), 1e-9);
        verify(router, times(1)).route(any());
        assertEquals(0, queue.size());
    }

    @Test
    void testInferEmitsResult() {
        InferenceRequest request = request("req-1", "hello there");
        gateway.submit(request);
        runWorker();

        StepVerifier.create(gateway.infer(request("req-2", "hello there")))
                .assertNext(result -> assertTrue(result.isCacheHit()))
                .verifyComplete();
    }

    @Test
    void testRemoteEmbeddingHitFromNonBlockingThread() {
        GatewayProperties.EmbeddingConfig embeddingConfig = new GatewayProperties.EmbeddingConfig();
        WebClient ollama = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body("{\"embedding\":[0.6,0.8,0.0]}")
                        .build()))
                .build();
        SemanticCache remoteCache = new SemanticCache(new GatewayProperties.CacheConfig(),
                new OllamaEmbeddingService(ollama, embeddingConfig), new RequestFingerprinter(), clock);
        gateway = new ModelGateway(remoteCache, queue, router, executor, clock);

        gateway.submit(request("req-1", "What is the capital of France?"));
        runWorker();

        StepVerifier.create(gateway.infer(request("req-2", "Tell me the capital of France"))
                        .subscribeOn(Schedulers.parallel()))
                .assertNext(result -> {
                    assertTrue(result.isCacheHit());
                    assertEquals("Paris", result.getOutput());
                })
                .verifyComplete();
        assertEquals(0, remoteCache.getStatistics().getEmbeddingFailures());
        verify(router, times(1)).route(any());
    }

    @Test
    void testFullQueueRejects() {
        queueConfig.setMaxDepth(1);
        gateway.submit(request("req-1", "first"));

        assertThrows(QueueRejectedException.class, () -> gateway.submit(request("req-2", "second")));
        assertEquals(1, queue.size());
    }

    @Test
    void testExpiredOnArrival() {
        InferenceRequest request = request("req-1", "late").toBuilder().deadline(clock.instant()).build();

        StepVerifier.create(gateway.infer(request))
                .expectError(RequestExpiredException.class)
                .verify();
        assertEquals(0, queue.size());
    }

    @Test
    void testExpiredWhileQueuedIsNotRouted() {
        InferenceRequest request = request("req-1", "slow").toBuilder()
                .deadline(clock.instant().plusSeconds(1))
                .build();
        CompletableFuture<InferenceResult> future = gateway.submit(request);

        clock.advanceSeconds(2);
        runWorker();

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(RequestExpiredException.class, error.getCause());
        verifyNoInteractions(router, executor);
    }

    @Test
    void testLateResultIsDiscarded() {
        doAnswer(invocation -> {
            clock.advanceSeconds(10);
            return InferenceResult.builder().modelId("gpt-4o-mini").output("too late").build();
        }).when(executor).execute(any(), any());
        InferenceRequest request = request("req-1", "slow provider").toBuilder()
                .deadline(clock.instant().plusSeconds(5))
                .build();
        CompletableFuture<InferenceResult> future = gateway.submit(request);

        runWorker();

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(RequestExpiredException.class, error.getCause());
        assertEquals(0, cache.size());
    }

    @Test
    void testRoutingFailureCompletesExceptionally() {
        when(router.route(any())).thenThrow(new AllProvidersUnavailableException("all open", Duration.ofSeconds(30)));
        CompletableFuture<InferenceResult> future = gateway.submit(request("req-1", "hello"));

        runWorker();

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(AllProvidersUnavailableException.class, error.getCause());
        verify(executor, never()).execute(any(), any());
        assertEquals(0, cache.size());
    }

    @Test
    void testInvalidRequests() {
        assertThrows(InvalidRequestException.class,
                () -> gateway.submit(request("req-1", "hi").toBuilder().callerId(" ").build()));
        assertThrows(InvalidRequestException.class,
                () -> gateway.submit(request("req-1", "hi").toBuilder().payload(null).build()));
        assertThrows(InvalidRequestException.class,
                () -> gateway.submit(request("req-1", "hi").toBuilder().maxOutputTokens(0).build()));
        assertThrows(InvalidRequestException.class,
                () -> gateway.submit(request("req-1", "hi").toBuilder().maxCost(-1.0).build()));
    }

    @Test
    void testMissingRequestIdIsAssigned() throws Exception {
        CompletableFuture<InferenceResult> future = gateway.submit(request(null, "no id"));
        runWorker();

        assertNotNull(future.get().getRequestId());
        assertFalse(future.get().getRequestId().isBlank());
    }

    @Test
    void testDuplicateInFlightRequestJoins() throws Exception {
        CompletableFuture<InferenceResult> first = gateway.submit(request("req-1", "duplicate"));
        CompletableFuture<InferenceResult> second = gateway.submit(request("req-1", "duplicate"));

        assertSame(first, second);
        assertEquals(1, queue.size());

        runWorker();
        assertEquals("Paris", second.get().getOutput());
        verify(executor, times(1)).execute(any(), any());
    }

    @Test
    void testNonCacheableRequestIsAlwaysRouted() {
        InferenceRequest request = request("req-1", "fresh every time").toBuilder().cacheable(false).build();
        gateway.submit(request);
        runWorker();
        gateway.submit(request.toBuilder().requestId("req-2").build());
        runWorker();

        verify(router, times(2)).route(any());
    }

    @Test
    void testStreamBypassesCacheAndQueue() {
        gateway.submit(request("req-1", "What is the capital of France?"));
        runWorker();
        when(executor.stream(any(), any())).thenReturn(Flux.just(
                StreamChunk.builder().index(0).contentDelta("Paris").build(),
                StreamChunk.builder().index(1).finalChunk(true).finishReason("stop").build()));

        StepVerifier.create(gateway.stream(request("req-2", "What is the capital of France?")))
                .assertNext(chunk -> assertEquals("Paris", chunk.getContentDelta()))
                .assertNext(chunk -> assertTrue(chunk.isFinalChunk()))
                .verifyComplete();

        ArgumentCaptor<InferenceRequest> routed = ArgumentCaptor.forClass(InferenceRequest.class);
        verify(router, times(2)).route(routed.capture());
        assertTrue(routed.getValue().effectiveCapabilities().contains(Capability.STREAMING));
        assertNotNull(routed.getValue().getEnqueueTime());
        assertEquals(0, queue.size());
        assertEquals(1, cache.size());
    }

    @Test
    void testStreamIsLazy() {
        when(executor.stream(any(), any())).thenReturn(Flux.empty());

        Flux<StreamChunk> stream = gateway.stream(request("req-1", "hello"));

        verify(router, never()).route(any());
        StepVerifier.create(stream).verifyComplete();
        verify(router).route(any());
    }

    @Test
    void testStreamSignalsRequestErrors() {
        StepVerifier.create(gateway.stream(request("req-1", "hi").toBuilder().callerId(" ").build()))
                .expectError(InvalidRequestException.class)
                .verify();
        StepVerifier.create(gateway.stream(request("req-2", "hi").toBuilder().deadline(clock.instant()).build()))
                .expectError(RequestExpiredException.class)
                .verify();

        when(router.route(any())).thenThrow(new AllProvidersUnavailableException("all open", Duration.ofSeconds(30)));
        StepVerifier.create(gateway.stream(request("req-3", "hi")))
                .expectError(AllProvidersUnavailableException.class)
                .verify();
        verify(executor, never()).stream(any(), any());
    }

    private void runWorker() {
        QueuedRequest next;
        while ((next = queue.dequeue()) != null) {
            gateway.process(next);
        }
    }

    private static InferenceRequest request(String requestId, String text) {
        return InferenceRequest.builder()
                .requestId(requestId)
                .callerId("alice")
                .payload(ChatPayload.builder().message(Message.of("user", text)).build())
                .build();
    }
}
