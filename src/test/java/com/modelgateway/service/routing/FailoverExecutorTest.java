package com.modelgateway.service.routing;

import com.modelgateway.MutableClock;
import com.modelgateway.config.GatewayProperties;
import com.modelgateway.exception.AllProvidersUnavailableException;
import com.modelgateway.exception.ProviderPermanentException;
import com.modelgateway.exception.ProviderTransientException;
import com.modelgateway.exception.RequestExpiredException;
import com.modelgateway.model.Capability;
import com.modelgateway.model.CircuitState;
import com.modelgateway.model.InferenceRequest;
import com.modelgateway.model.InferenceResult;
import com.modelgateway.model.LatencyClass;
import com.modelgateway.model.ModelDescriptor;
import com.modelgateway.model.RoutingDecision;
import com.modelgateway.model.StreamChunk;
import com.modelgateway.model.payload.ChatPayload;
import com.modelgateway.model.payload.Message;
import com.modelgateway.provider.ProviderAdapter;
import com.modelgateway.provider.ProviderAdapterRegistry;
import com.modelgateway.provider.ProviderErrorKind;
import com.modelgateway.provider.ProviderException;
import com.modelgateway.service.circuit.CircuitBreaker;
import com.modelgateway.service.ratelimit.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for FailoverExecutor.
 */
class FailoverExecutorTest {

    private static final ModelDescriptor MODEL_A = model("a-chat", "provider-a", 1.0);
    private static final ModelDescriptor MODEL_B = model("b-chat", "provider-b", 2.0);
    private static final ModelDescriptor MODEL_C = model("c-chat", "provider-c", 3.0);

    private MutableClock clock;
    private ProviderAdapter adapterA;
    private ProviderAdapter adapterB;
    private ProviderAdapter adapterC;
    private CircuitBreaker circuitBreaker;
    private GatewayProperties.RateLimitConfig rateLimitConfig;
    private RateLimiter rateLimiter;
    private GatewayProperties.RouterConfig routerConfig;
    private FailoverExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        adapterA = adapter("provider-a");
        adapterB = adapter("provider-b");
        adapterC = adapter("provider-c");
        circuitBreaker = new CircuitBreaker(new GatewayProperties.CircuitBreakerConfig(), clock);
        rateLimitConfig = new GatewayProperties.RateLimitConfig();
        rateLimiter = new RateLimiter(rateLimitConfig, clock);
        routerConfig = new GatewayProperties.RouterConfig();
        executor = new FailoverExecutor(
                new ProviderAdapterRegistry(List.of(adapterA, adapterB, adapterC)),
                circuitBreaker, rateLimiter, routerConfig, clock);
    }

    @Test
    void testPrimarySuccess() {
        when(adapterA.invoke(eq(MODEL_A), any(), anyInt(), any()))
                .thenAnswer(invocation -> {
                    clock.advance(Duration.ofMillis(250));
                    return Mono.just(reply(MODEL_A, 1000, 500));
                });

        InferenceResult result = executor.execute(request(), decision(MODEL_A, MODEL_B));

        assertEquals("req-1", result.getRequestId());
        assertEquals("a-chat", result.getModelId());
        assertEquals("provider-a", result.getProvider());
        assertEquals(1.5, result.getCost(), 1e-9);
        assertEquals(Duration.ofMillis(250), result.getLatency());
        assertFalse(result.isCacheHit());
        assertEquals(1, circuitBreaker.getStatus("provider-a").getTotalSuccesses());
        verify(adapterB, never()).invoke(any(), any(), anyInt(), any());
    }

    @Test
    void testTransientFailureFailsOverToNextCandidate() {
        when(adapterA.invoke(any(), any(), anyInt(), any()))
                .thenReturn(Mono.error(ProviderException.transientError("provider-a", "timeout")));
        when(adapterB.invoke(eq(MODEL_B), any(), anyInt(), any()))
                .thenReturn(Mono.just(reply(MODEL_B, 10, 10)));

        InferenceResult result = executor.execute(request(), decision(MODEL_A, MODEL_B));

        assertEquals("b-chat", result.getModelId());
        assertEquals(1, circuitBreaker.getStatus("provider-a").getConsecutiveFailures());
        assertEquals(1, circuitBreaker.getStatus("provider-b").getTotalSuccesses());
    }

    @Test
    void testHttpErrorsAreClassified() {
        when(adapterA.invoke(any(), any(), anyInt(), any()))
                .thenReturn(Mono.error(httpError(503)));
        when(adapterB.invoke(any(), any(), anyInt(), any()))
                .thenReturn(Mono.error(httpError(401)));

        assertThrows(ProviderPermanentException.class,
                () -> executor.execute(request(), decision(MODEL_A, MODEL_B)));

        assertEquals(1, circuitBreaker.getStatus("provider-a").getTotalFailures());
        assertEquals(0, circuitBreaker.getStatus("provider-b").getTotalFailures());
    }

    @Test
    void testPermanentFailureIsSurfacedWithoutFailover() {
        when(adapterA.invoke(any(), any(), anyInt(), any()))
                .thenReturn(Mono.error(new ProviderException(ProviderErrorKind.PERMANENT, "provider-a", "invalid api key")));

        ProviderPermanentException error = assertThrows(ProviderPermanentException.class,
                () -> executor.execute(request(), decision(MODEL_A, MODEL_B)));

        assertTrue(error.getMessage().contains("invalid api key"));
        assertEquals(0, circuitBreaker.getStatus("provider-a").getTotalFailures());
        verify(adapterB, never()).invoke(any(), any(), anyInt(), any());
    }

    @Test
    void testFailoverIsBounded() {
        routerConfig.setMaxFailover(1);
        when(adapterA.invoke(any(), any(), anyInt(), any()))
                .thenReturn(Mono.error(ProviderException.transientError("provider-a", "503")));
        when(adapterB.invoke(any(), any(), anyInt(), any()))
                .thenReturn(Mono.error(ProviderException.transientError("provider-b", "503")));

        ProviderTransientException error = assertThrows(ProviderTransientException.class,
                () -> executor.execute(request(), decision(MODEL_A, MODEL_B, MODEL_C)));

        assertEquals(2, error.getAttempts());
        verify(adapterC, never()).invoke(any(), any(), anyInt(), any());
    }

    @Test
    void testCandidateThatLostCircuitPermissionIsSkipped() {
        for (int i = 0; i < 5; i++) {
            circuitBreaker.recordOutcome(circuitBreaker.tryAcquirePermission("provider-a").orElseThrow(), false);
        }
        when(adapterB.invoke(any(), any(), anyInt(), any()))
                .thenReturn(Mono.just(reply(MODEL_B, 10, 10)));

        InferenceResult result = executor.execute(request(), decision(MODEL_A, MODEL_B));

        assertEquals("b-chat", result.getModelId());
        verify(adapterA, never()).invoke(any(), any(), anyInt(), any());
    }

    @Test
    void testRateLimitedCandidateReleasesHalfOpenProbe() {
        for (int i = 0; i < 5; i++) {
            circuitBreaker.recordOutcome(circuitBreaker.tryAcquirePermission("provider-a").orElseThrow(), false);
        }
        clock.advanceSeconds(30);
        rateLimitConfig.setDefaultCapacity(2_000);
        rateLimiter.tryAcquire("alice", "provider-a", 2_000);
        when(adapterB.invoke(any(), any(), anyInt(), any()))
                .thenReturn(Mono.just(reply(MODEL_B, 10, 10)));

        executor.execute(request(), decision(MODEL_A, MODEL_B));

        assertEquals(CircuitState.HALF_OPEN, circuitBreaker.getState("provider-a"));
        assertTrue(circuitBreaker.tryAcquirePermission("provider-a").isPresent());
    }

    @Test
    void testNoClaimableCandidateIsUnavailable() {
        for (int i = 0; i < 5; i++) {
            circuitBreaker.recordOutcome(circuitBreaker.tryAcquirePermission("provider-a").orElseThrow(), false);
        }

        AllProvidersUnavailableException error = assertThrows(AllProvidersUnavailableException.class,
                () -> executor.execute(request(), decision(MODEL_A)));

        assertEquals(Duration.ofSeconds(30), error.getRetryAfter());
    }

    @Test
    void testExpiredRequestIsNotInvoked() {
        InferenceRequest expired = request().toBuilder().deadline(clock.instant()).build();

        assertThrows(RequestExpiredException.class, () -> executor.execute(expired, decision(MODEL_A)));
        verify(adapterA, never()).invoke(any(), any(), anyInt(), any());
    }

    @Test
    void testTimeoutIsBoundedByDeadline() {
        InferenceRequest request = request().toBuilder().deadline(clock.instant().plusSeconds(5)).build();
        when(adapterA.invoke(any(), any(), anyInt(), any()))
                .thenReturn(Mono.just(reply(MODEL_A, 10, 10)));

        executor.execute(request, decision(MODEL_A));

        verify(adapterA).invoke(eq(MODEL_A), any(), eq(1024), eq(Duration.ofSeconds(5)));
    }

    @Test
    void testTokensAreChargedToCallerBucket() {
        when(adapterA.invoke(any(), any(), anyInt(), any()))
                .thenReturn(Mono.just(reply(MODEL_A, 10, 10)));

        executor.execute(request(), decision(MODEL_A));

        double remaining = rateLimiter.getBucketStates().get(0).getTokens();
        assertEquals(rateLimitConfig.getDefaultCapacity() - request().estimatedTotalTokens(), remaining, 1e-6);
    }

    @Test
    void testStreamTagsChunksAndRecordsSuccess() {
        when(adapterA.stream(eq(MODEL_A), any(), anyInt(), any()))
                .thenReturn(Flux.just(chunk(0, "Hel"), chunk(1, "lo"), finalChunk(2)));

        StepVerifier.create(executor.stream(request(), decision(MODEL_A, MODEL_B)))
                .assertNext(chunk -> {
                    assertEquals("req-1", chunk.getRequestId());
                    assertEquals("a-chat", chunk.getModelId());
                    assertEquals("provider-a", chunk.getProvider());
                    assertEquals("Hel", chunk.getContentDelta());
                })
                .expectNextCount(1)
                .assertNext(chunk -> assertTrue(chunk.isFinalChunk()))
                .verifyComplete();

        assertEquals(1, circuitBreaker.getStatus("provider-a").getTotalSuccesses());
        verify(adapterB, never()).stream(any(), any(), anyInt(), any());
    }

    @Test
    void testStreamFailsOverBeforeFirstChunk() {
        when(adapterA.stream(any(), any(), anyInt(), any()))
                .thenReturn(Flux.error(ProviderException.transientError("provider-a", "connection reset")));
        when(adapterB.stream(eq(MODEL_B), any(), anyInt(), any()))
                .thenReturn(Flux.just(chunk(0, "hi"), finalChunk(1)));

        StepVerifier.create(executor.stream(request(), decision(MODEL_A, MODEL_B)))
                .assertNext(chunk -> assertEquals("b-chat", chunk.getModelId()))
                .expectNextCount(1)
                .verifyComplete();

        assertEquals(1, circuitBreaker.getStatus("provider-a").getConsecutiveFailures());
        assertEquals(1, circuitBreaker.getStatus("provider-b").getTotalSuccesses());
    }

    @Test
    void testStreamFailureAfterFirstChunkEndsStream() {
        when(adapterA.stream(any(), any(), anyInt(), any()))
                .thenReturn(Flux.just(chunk(0, "partial"))
                        .concatWith(Flux.error(ProviderException.transientError("provider-a", "connection reset"))));

        StepVerifier.create(executor.stream(request(), decision(MODEL_A, MODEL_B)))
                .expectNextCount(1)
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(ProviderTransientException.class, error);
                    assertTrue(error.getMessage().contains("mid-response"));
                })
                .verify();

        assertEquals(1, circuitBreaker.getStatus("provider-a").getTotalFailures());
        verify(adapterB, never()).stream(any(), any(), anyInt(), any());
    }

    @Test
    void testStreamPermanentFailureIsSurfaced() {
        when(adapterA.stream(any(), any(), anyInt(), any()))
                .thenReturn(Flux.error(new ProviderException(ProviderErrorKind.PERMANENT, "provider-a", "invalid api key")));

        StepVerifier.create(executor.stream(request(), decision(MODEL_A, MODEL_B)))
                .expectError(ProviderPermanentException.class)
                .verify();

        assertEquals(0, circuitBreaker.getStatus("provider-a").getTotalFailures());
        verify(adapterB, never()).stream(any(), any(), anyInt(), any());
    }

    @Test
    void testStreamFailoverIsBounded() {
        routerConfig.setMaxFailover(0);
        when(adapterA.stream(any(), any(), anyInt(), any()))
                .thenReturn(Flux.error(ProviderException.transientError("provider-a", "503")));

        StepVerifier.create(executor.stream(request(), decision(MODEL_A, MODEL_B)))
                .expectErrorSatisfies(error -> assertEquals(1, ((ProviderTransientException) error).getAttempts()))
                .verify();

        verify(adapterB, never()).stream(any(), any(), anyInt(), any());
    }

    @Test
    void testStreamWithNoClaimableCandidateIsUnavailable() {
        for (int i = 0; i < 5; i++) {
            circuitBreaker.recordOutcome(circuitBreaker.tryAcquirePermission("provider-a").orElseThrow(), false);
        }

        StepVerifier.create(executor.stream(request(), decision(MODEL_A)))
                .expectError(AllProvidersUnavailableException.class)
                .verify();
    }

    @Test
    void testCancelledStreamReleasesHalfOpenPermit() {
        for (int i = 0; i < 5; i++) {
            circuitBreaker.recordOutcome(circuitBreaker.tryAcquirePermission("provider-a").orElseThrow(), false);
        }
        clock.advanceSeconds(30);
        when(adapterA.stream(any(), any(), anyInt(), any()))
                .thenReturn(Flux.just(chunk(0, "hi")).concatWith(Flux.never()));

        StepVerifier.create(executor.stream(request(), decision(MODEL_A)))
                .expectNextCount(1)
                .thenCancel()
                .verify();

        assertEquals(CircuitState.HALF_OPEN, circuitBreaker.getState("provider-a"));
        assertEquals(5, circuitBreaker.getStatus("provider-a").getTotalFailures());
        assertTrue(circuitBreaker.tryAcquirePermission("provider-a").isPresent());
    }

    private static StreamChunk chunk(int index, String delta) {
        return StreamChunk.builder().index(index).contentDelta(delta).build();
    }

    private static StreamChunk finalChunk(int index) {
        return StreamChunk.builder().index(index).finalChunk(true).finishReason("stop").outputTokens(2).build();
    }

    private static ProviderAdapter adapter(String name) {
        ProviderAdapter adapter = mock(ProviderAdapter.class);
        when(adapter.getName()).thenReturn(name);
        when(adapter.isEnabled()).thenReturn(true);
        return adapter;
    }

    private static InferenceRequest request() {
        return InferenceRequest.builder()
                .requestId("req-1")
                .callerId("alice")
                .payload(ChatPayload.builder().message(Message.of("user", "hello")).build())
                .build();
    }

    private static RoutingDecision decision(ModelDescriptor... candidates) {
        return RoutingDecision.builder()
                .candidates(List.of(candidates))
                .build();
    }

    private static InferenceResult reply(ModelDescriptor model, int inputTokens, int outputTokens) {
        return InferenceResult.builder()
                .modelId(model.getId())
                .provider(model.getProvider())
                .output("hi")
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .build();
    }

    private static WebClientResponseException httpError(int status) {
        return new WebClientResponseException(status, "HTTP " + status, HttpHeaders.EMPTY,
                new byte[0], StandardCharsets.UTF_8);
    }

    private static ModelDescriptor model(String id, String provider, double costPer1k) {
        return ModelDescriptor.builder()
                .id(id)
                .provider(provider)
                .capability(Capability.CHAT)
                .inputCostPer1k(costPer1k)
                .outputCostPer1k(costPer1k)
                .maxContextTokens(128_000)
                .latencyClass(LatencyClass.FAST)
                .build();
    }
}
