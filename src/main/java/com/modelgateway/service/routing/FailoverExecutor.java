package com.modelgateway.service.routing;

import com.modelgateway.config.GatewayProperties;
import com.modelgateway.exception.AllProvidersUnavailableException;
import com.modelgateway.exception.ProviderPermanentException;
import com.modelgateway.exception.ProviderTransientException;
import com.modelgateway.exception.RequestExpiredException;
import com.modelgateway.model.InferenceRequest;
import com.modelgateway.model.InferenceResult;
import com.modelgateway.model.ModelDescriptor;
import com.modelgateway.model.RoutingDecision;
import com.modelgateway.model.StreamChunk;
import com.modelgateway.provider.ProviderAdapter;
import com.modelgateway.provider.ProviderAdapterRegistry;
import com.modelgateway.provider.ProviderErrors;
import com.modelgateway.provider.ProviderException;
import com.modelgateway.service.circuit.CircuitBreaker;
import com.modelgateway.service.circuit.CircuitPermit;
import com.modelgateway.service.ratelimit.RateLimitDecision;
import com.modelgateway.service.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Invokes the ranked candidates of a {@link RoutingDecision} until one succeeds.
 *
 * <p>
 * Before each call the executor claims the provider's circuit permission and
 * consumes the rate limit tokens. A candidate that lost either race since
 * routing is skipped without counting as an attempt. Transient failures are
 * recorded against the circuit and move on to the next candidate, up to
 * {@code 1 + gateway.router.max-failover} invocations. Permanent failures are
 * surfaced immediately and do not touch circuit health.
 */
@Slf4j
public class FailoverExecutor {

    private static final Duration MIN_TIMEOUT = Duration.ofMillis(1);

    private final ProviderAdapterRegistry adapters;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final GatewayProperties.RouterConfig config;
    private final Clock clock;

    public FailoverExecutor(ProviderAdapterRegistry adapters,
                            CircuitBreaker circuitBreaker,
                            RateLimiter rateLimiter,
                            GatewayProperties.RouterConfig config,
                            Clock clock) {
        this.adapters = adapters;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.clock = clock;
    }

    public InferenceResult execute(InferenceRequest request, RoutingDecision decision) {
        int maxAttempts = 1 + Math.max(0, config.getMaxFailover());
        int attempts = 0;
        ProviderException lastError = null;

        for (ModelDescriptor model : decision.getCandidates()) {
            if (attempts >= maxAttempts) {
                break;
            }
            if (request.isExpired(clock.instant())) {
                throw new RequestExpiredException(request.getRequestId());
            }

            String provider = model.getProvider();
            Optional<ProviderAdapter> adapter = adapters.find(provider);
            if (adapter.isEmpty()) {
                log.warn("No adapter registered for provider {}, skipping model {}", provider, model.getId());
                continue;
            }
            Optional<CircuitPermit> permit = claim(request, model);
            if (permit.isEmpty()) {
                continue;
            }

            attempts++;
            Instant start = clock.instant();
            try {
                InferenceResult result = adapter.get()
                        .invoke(model, request.getPayload(), request.getMaxOutputTokens(), timeoutFor(request, start))
                        .block();
                if (result == null) {
                    throw ProviderException.transientError(provider, provider + " returned an empty response");
                }
                circuitBreaker.recordOutcome(permit.get(), true);
                return complete(request, model, result, Duration.between(start, clock.instant()));
            } catch (RuntimeException e) {
                ProviderException error = ProviderErrors.classify(provider, Exceptions.unwrap(e));
                if (!error.isTransient()) {
                    circuitBreaker.releasePermission(permit.get());
                    log.info("Permanent error from {} for request {}: {}",
                            provider, request.getRequestId(), error.getMessage());
                    throw new ProviderPermanentException(error.getMessage(), error);
                }
                circuitBreaker.recordOutcome(permit.get(), false);
                lastError = error;
                log.warn("Transient error from {} for request {} (attempt {}/{}): {}",
                        provider, request.getRequestId(), attempts, maxAttempts, error.getMessage());
            }
        }

        if (attempts == 0) {
            throw new AllProvidersUnavailableException(
                    "No candidate could be claimed for request " + request.getRequestId(), earliestRetry(decision));
        }
        throw new ProviderTransientException(
                "Request " + request.getRequestId() + " failed after " + attempts + " attempt(s): "
                        + (lastError == null ? "no response" : lastError.getMessage()),
                attempts, lastError);
    }

    /**
     * Stream the response from the first candidate that can be claimed.
     *
     * <p>
     * Candidates are claimed the same way as in {@link #execute}. A transient
     * failure before the first chunk fails over to the next candidate; once a
     * chunk has been emitted the stream cannot be restarted elsewhere, so the
     * failure ends it. A cancelled stream gives its permit back without a
     * health signal.
     */
    public Flux<StreamChunk> stream(InferenceRequest request, RoutingDecision decision) {
        int maxAttempts = 1 + Math.max(0, config.getMaxFailover());
        return streamFrom(request, decision, 0, 0, maxAttempts, null);
    }

    private Flux<StreamChunk> streamFrom(InferenceRequest request, RoutingDecision decision,
                                         int from, int attempts, int maxAttempts, ProviderException lastError) {
        return Flux.defer(() -> {
            List<ModelDescriptor> candidates = decision.getCandidates();
            for (int i = from; i < candidates.size() && attempts < maxAttempts; i++) {
                if (request.isExpired(clock.instant())) {
                    return Flux.error(new RequestExpiredException(request.getRequestId()));
                }
                ModelDescriptor model = candidates.get(i);
                Optional<ProviderAdapter> adapter = adapters.find(model.getProvider());
                if (adapter.isEmpty()) {
                    log.warn("No adapter registered for provider {}, skipping model {}", model.getProvider(), model.getId());
                    continue;
                }
                Optional<CircuitPermit> permit = claim(request, model);
                if (permit.isPresent()) {
                    return streamOn(request, decision, i, attempts + 1, maxAttempts, adapter.get(), model, permit.get());
                }
            }

            if (attempts == 0) {
                return Flux.error(new AllProvidersUnavailableException(
                        "No candidate could be claimed for request " + request.getRequestId(), earliestRetry(decision)));
            }
            return Flux.error(new ProviderTransientException(
                    "Stream " + request.getRequestId() + " failed after " + attempts + " attempt(s): "
                            + (lastError == null ? "no response" : lastError.getMessage()),
                    attempts, lastError));
        });
    }

    private Flux<StreamChunk> streamOn(InferenceRequest request, RoutingDecision decision, int position,
                                       int attempts, int maxAttempts, ProviderAdapter adapter,
                                       ModelDescriptor model, CircuitPermit permit) {
        String provider = model.getProvider();
        AtomicBoolean emitted = new AtomicBoolean();
        AtomicBoolean settled = new AtomicBoolean();
        Instant start = clock.instant();

        return adapter.stream(model, request.getPayload(), request.getMaxOutputTokens(), timeoutFor(request, start))
                .map(chunk -> chunk.toBuilder()
                        .requestId(request.getRequestId())
                        .modelId(model.getId())
                        .provider(provider)
                        .build())
                .doOnNext(chunk -> emitted.set(true))
                .doOnComplete(() -> {
                    if (settled.compareAndSet(false, true)) {
                        circuitBreaker.recordOutcome(permit, true);
                        log.debug("Stream {} served by {} in {}ms", request.getRequestId(), model.getId(),
                                Duration.between(start, clock.instant()).toMillis());
                    }
                })
                .doOnCancel(() -> {
                    if (settled.compareAndSet(false, true)) {
                        circuitBreaker.releasePermission(permit);
                        log.debug("Stream {} cancelled by the caller", request.getRequestId());
                    }
                })
                .onErrorResume(e -> {
                    ProviderException error = ProviderErrors.classify(provider, Exceptions.unwrap(e));
                    settled.set(true);
                    if (!error.isTransient()) {
                        circuitBreaker.releasePermission(permit);
                        log.info("Permanent error from {} for stream {}: {}",
                                provider, request.getRequestId(), error.getMessage());
                        return Flux.error(new ProviderPermanentException(error.getMessage(), error));
                    }
                    circuitBreaker.recordOutcome(permit, false);
                    if (emitted.get()) {
                        log.warn("Stream {} from {} failed mid-response: {}",
                                request.getRequestId(), provider, error.getMessage());
                        return Flux.error(new ProviderTransientException(
                                "Stream " + request.getRequestId() + " failed mid-response: " + error.getMessage(),
                                attempts, error));
                    }
                    log.warn("Transient error from {} for stream {} (attempt {}/{}): {}",
                            provider, request.getRequestId(), attempts, maxAttempts, error.getMessage());
                    return streamFrom(request, decision, position + 1, attempts, maxAttempts, error);
                });
    }

    /**
     * Claim the circuit permit and the caller's rate limit tokens for one call
     * to {@code model}, or neither.
     */
    private Optional<CircuitPermit> claim(InferenceRequest request, ModelDescriptor model) {
        String provider = model.getProvider();
        Optional<CircuitPermit> permit = circuitBreaker.tryAcquirePermission(provider);
        if (permit.isEmpty()) {
            log.debug("Circuit for {} no longer permits calls, skipping model {}", provider, model.getId());
            return permit;
        }
        RateLimitDecision limit = rateLimiter.tryAcquire(
                request.getCallerId(), provider, request.estimatedTotalTokens());
        if (!limit.isAllowed()) {
            circuitBreaker.releasePermission(permit.get());
            log.debug("Rate limit for {} exhausted since routing, skipping model {}", provider, model.getId());
            return Optional.empty();
        }
        return permit;
    }

    private InferenceResult complete(InferenceRequest request, ModelDescriptor model,
                                     InferenceResult result, Duration latency) {
        log.debug("Request {} served by {} in {}ms", request.getRequestId(), model.getId(), latency.toMillis());
        return result.toBuilder()
                .requestId(request.getRequestId())
                .modelId(model.getId())
                .provider(model.getProvider())
                .cost(model.estimateCost(result.getInputTokens(), result.getOutputTokens()))
                .latency(latency)
                .cacheHit(false)
                .cacheSimilarity(0.0)
                .build();
    }

    private Duration timeoutFor(InferenceRequest request, Instant now) {
        if (request.getDeadline() == null) {
            return config.getInvokeTimeout();
        }
        Duration remaining = Duration.between(now, request.getDeadline());
        if (remaining.compareTo(MIN_TIMEOUT) < 0) {
            return MIN_TIMEOUT;
        }
        return remaining.compareTo(config.getInvokeTimeout()) < 0 ? remaining : config.getInvokeTimeout();
    }

    private Duration earliestRetry(RoutingDecision decision) {
        return decision.getCandidates().stream()
                .map(model -> circuitBreaker.timeUntilRetry(model.getProvider()))
                .filter(wait -> !wait.isZero())
                .min(Duration::compareTo)
                .orElse(null);
    }
}
