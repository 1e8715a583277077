package com.modelgateway.service;

import com.modelgateway.exception.InvalidRequestException;
import com.modelgateway.exception.QueueRejectedException;
import com.modelgateway.exception.RequestExpiredException;
import com.modelgateway.model.Capability;
import com.modelgateway.model.InferenceRequest;
import com.modelgateway.model.InferenceResult;
import com.modelgateway.model.RoutingDecision;
import com.modelgateway.model.StreamChunk;
import com.modelgateway.service.cache.CacheLookup;
import com.modelgateway.service.cache.SemanticCache;
import com.modelgateway.service.queue.QueueAdmission;
import com.modelgateway.service.queue.QueuedRequest;
import com.modelgateway.service.queue.RequestQueue;
import com.modelgateway.service.routing.FailoverExecutor;
import com.modelgateway.service.routing.Router;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main gateway service that orchestrates cache lookup, admission and routing.
 *
 * <p>
 * {@link #infer(InferenceRequest)} runs on the caller's side, on a bounded
 * elastic thread: a semantic cache hit is answered immediately without touching
 * any provider state, a miss is queued. {@link #process(QueuedRequest)} runs on a worker thread: it routes,
 * invokes with failover, and stores successful results back in the cache.
 *
 * <p>
 * Request ids are idempotency keys: a request whose id is already in flight
 * joins the existing result rather than being served twice.
 */
@Slf4j
@Service
public class ModelGateway {

    private final SemanticCache cache;
    private final RequestQueue queue;
    private final Router router;
    private final FailoverExecutor executor;
    private final Clock clock;

    private final Map<String, CompletableFuture<InferenceResult>> inFlight = new ConcurrentHashMap<>();

    public ModelGateway(SemanticCache cache,
                        RequestQueue queue,
                        Router router,
                        FailoverExecutor executor,
                        Clock clock) {
        this.cache = cache;
        this.queue = queue;
        this.router = router;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Serve an inference request.
     *
     * Errors are signalled with the {@link com.modelgateway.exception.GatewayException}
     * subclass matching the failure.
     */
    public Mono<InferenceResult> infer(InferenceRequest request) {
        // A cancelled subscriber must not cancel a result other duplicates may be waiting on.
        // Cache lookup can block on a remote embedding call, so it never runs on the event loop.
        return Mono.defer(() -> Mono.fromFuture(submit(request), true))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Stream an inference response.
     *
     * Streams bypass the cache and the queue: they are routed immediately to
     * streaming-capable models, still subject to circuit state and the caller's
     * rate limits.
     */
    public Flux<StreamChunk> stream(InferenceRequest incoming) {
        return Flux.defer(() -> {
            Instant now = clock.instant();
            InferenceRequest request = validate(incoming).toBuilder()
                    .requiredCapability(Capability.STREAMING)
                    .enqueueTime(now)
                    .build();
            if (request.isExpired(now)) {
                throw new RequestExpiredException(request.getRequestId());
            }
            log.debug("Streaming request {} from {}", request.getRequestId(), request.getCallerId());
            return executor.stream(request, router.route(request));
        });
    }

    CompletableFuture<InferenceResult> submit(InferenceRequest incoming) {
        Instant now = clock.instant();
        InferenceRequest request = validate(incoming).toBuilder().enqueueTime(now).build();

        if (request.isExpired(now)) {
            throw new RequestExpiredException(request.getRequestId());
        }

        Optional<CacheLookup> hit = cache.lookup(request);
        if (hit.isPresent()) {
            return CompletableFuture.completedFuture(fromCache(request, hit.get(), now));
        }

        QueuedRequest item = new QueuedRequest(request);
        CompletableFuture<InferenceResult> existing = inFlight.putIfAbsent(request.getRequestId(), item.getResult());
        if (existing != null) {
            log.debug("Request {} already in flight, joining existing result", request.getRequestId());
            return existing;
        }
        item.getResult().whenComplete((result, error) -> inFlight.remove(request.getRequestId(), item.getResult()));

        QueueAdmission admission = queue.enqueue(item);
        if (!admission.accepted()) {
            QueueRejectedException rejected = new QueueRejectedException(admission.reason());
            item.getResult().completeExceptionally(rejected);
            throw rejected;
        }
        log.debug("Queued request {} from {} (priority={}, depth={})",
                request.getRequestId(), request.getCallerId(), request.getPriority(), admission.depth());
        return item.getResult();
    }

    /**
     * Serve one dequeued request and complete its future. Never throws.
     */
    public void process(QueuedRequest item) {
        InferenceRequest request = item.getRequest();
        try {
            if (request.isExpired(clock.instant())) {
                log.warn("Request {} expired in queue, dropping without a provider call", request.getRequestId());
                item.getResult().completeExceptionally(new RequestExpiredException(request.getRequestId()));
                return;
            }

            RoutingDecision decision = router.route(request);
            InferenceResult result = executor.execute(request, decision);

            if (request.isExpired(clock.instant())) {
                log.warn("Request {} completed after its deadline, discarding result from {}",
                        request.getRequestId(), result.getModelId());
                item.getResult().completeExceptionally(new RequestExpiredException(request.getRequestId()));
                return;
            }

            cache.store(request, result);
            item.getResult().complete(result);
        } catch (RuntimeException e) {
            item.getResult().completeExceptionally(e);
        }
    }

    private InferenceResult fromCache(InferenceRequest request, CacheLookup hit, Instant start) {
        log.info("Serving {} cached response for request {} (similarity={})",
                hit.exact() ? "exact" : "semantic", request.getRequestId(), String.format("%.3f", hit.similarity()));
        return hit.entry().getResult().toBuilder()
                .requestId(request.getRequestId())
                .cacheHit(true)
                .cacheSimilarity(hit.similarity())
                .cost(0.0)
                .latency(Duration.between(start, clock.instant()))
                .build();
    }

    private InferenceRequest validate(InferenceRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        if (request.getPayload() == null) {
            throw new InvalidRequestException("Request payload is required");
        }
        if (request.getCallerId() == null || request.getCallerId().isBlank()) {
            throw new InvalidRequestException("callerId is required");
        }
        if (request.getMaxOutputTokens() < 1) {
            throw new InvalidRequestException("maxOutputTokens must be positive");
        }
        if (request.getMaxCost() != null && request.getMaxCost() < 0) {
            throw new InvalidRequestException("maxCost must not be negative");
        }
        if (request.getRequestId() == null || request.getRequestId().isBlank()) {
            return request.toBuilder().requestId(UUID.randomUUID().toString()).build();
        }
        return request;
    }
}
