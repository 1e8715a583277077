package com.modelgateway.service.routing;

import com.modelgateway.config.GatewayProperties;
import com.modelgateway.exception.AllProvidersUnavailableException;
import com.modelgateway.exception.CapabilityUnavailableException;
import com.modelgateway.model.Capability;
import com.modelgateway.model.InferenceRequest;
import com.modelgateway.model.ModelDescriptor;
import com.modelgateway.model.RoutingDecision;
import com.modelgateway.model.RoutingStrategy;
import com.modelgateway.service.circuit.CircuitBreaker;
import com.modelgateway.service.ratelimit.RateLimitDecision;
import com.modelgateway.service.ratelimit.RateLimiter;
import com.modelgateway.service.registry.CatalogSnapshot;
import com.modelgateway.service.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Selects ranked candidate models for a request.
 *
 * Pipeline:
 * 1. Registry entries supporting every effective capability
 * 2. Hard constraints: max cost, context length, data residency
 * 3. Soft latency bound (ignored if it would leave nothing)
 * 4. Under {@link RoutingStrategy#PROVIDER_PINNED}, the preferred providers only
 *    (ignored if none of them can serve the request)
 * 5. Providers whose circuit is not available are excluded
 * 6. (caller, provider) pairs the rate limiter would deny are excluded
 * 7. Rank preferred providers first, then by the strategy's key, then by
 *    estimated cost, latency class, provider and model id
 *
 * Routing only reads breaker and limiter state; nothing is consumed until the
 * failover executor commits to a candidate. Given the same snapshot and
 * breaker/limiter state the result is the same for the same request.
 */
@Slf4j
public class Router {

    static final String DEFAULT_QUALITY_DIMENSION = "reasoning";

    private final ModelRegistry registry;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final GatewayProperties.RouterConfig config;

    public Router(ModelRegistry registry, CircuitBreaker circuitBreaker, RateLimiter rateLimiter,
                  GatewayProperties.RouterConfig config) {
        this.registry = registry;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.config = config;
    }

    /**
     * @throws CapabilityUnavailableException   no model matches the capabilities and constraints
     * @throws AllProvidersUnavailableException every matching model is excluded by breaker or limiter
     */
    public RoutingDecision route(InferenceRequest request) {
        CatalogSnapshot snapshot = registry.snapshot();
        Set<Capability> capabilities = request.effectiveCapabilities();
        RoutingDecision.RoutingDecisionBuilder decision = RoutingDecision.builder();

        List<ModelDescriptor> capable = snapshot.list(capabilities);
        if (capable.isEmpty()) {
            throw new CapabilityUnavailableException("No enabled model supports " + capabilities);
        }

        int inputTokens = request.estimatedInputTokens();
        int outputTokens = request.getMaxOutputTokens();
        int totalTokens = request.estimatedTotalTokens();

        List<ModelDescriptor> eligible = new ArrayList<>();
        for (ModelDescriptor model : capable) {
            double cost = model.estimateCost(inputTokens, outputTokens);
            if (request.getMaxCost() != null && cost > request.getMaxCost()) {
                decision.exclusion(model.getId(), String.format("estimated cost %.6f exceeds max %.6f", cost, request.getMaxCost()));
            } else if (!model.fitsContext(totalTokens)) {
                decision.exclusion(model.getId(), "needs " + totalTokens + " tokens, context is " + model.getMaxContextTokens());
            } else if (!model.servesAnyRegion(request.getAllowedRegions())) {
                decision.exclusion(model.getId(), "not hosted in " + request.getAllowedRegions());
            } else {
                eligible.add(model);
            }
        }
        if (eligible.isEmpty()) {
            throw new CapabilityUnavailableException("No model supporting " + capabilities
                    + " satisfies the request's cost, context and region constraints");
        }

        eligible = applyLatencyBound(request, eligible, decision);
        RoutingStrategy strategy = request.getStrategy() != null ? request.getStrategy() : config.getDefaultStrategy();
        if (strategy == RoutingStrategy.PROVIDER_PINNED) {
            eligible = applyProviderPin(request, eligible, decision);
        }

        List<ModelDescriptor> available = new ArrayList<>();
        Duration earliestRetry = null;
        for (ModelDescriptor model : eligible) {
            String provider = model.getProvider();
            if (!circuitBreaker.isAvailable(provider)) {
                decision.exclusion(model.getId(), "circuit " + circuitBreaker.getState(provider) + " for " + provider);
                earliestRetry = earliest(earliestRetry, circuitBreaker.timeUntilRetry(provider));
                continue;
            }
            RateLimitDecision limit = rateLimiter.wouldAllow(request.getCallerId(), provider, totalTokens);
            if (!limit.isAllowed()) {
                decision.exclusion(model.getId(), "rate limited on " + provider);
                earliestRetry = earliest(earliestRetry, limit.getRetryAfter());
                continue;
            }
            available.add(model);
        }

        if (available.isEmpty()) {
            log.info("All {} candidates for request {} are unavailable, retry after {}",
                    eligible.size(), request.getRequestId(), earliestRetry);
            throw new AllProvidersUnavailableException(
                    "All " + eligible.size() + " candidate models are unavailable", earliestRetry);
        }

        available.sort(ranking(strategy, request));
        ModelDescriptor primary = available.get(0);
        RoutingDecision result = decision
                .candidates(available)
                .estimatedCost(primary.estimateCost(inputTokens, outputTokens))
                .strategy(strategy)
                .build();

        log.debug("Routed request {} to {} by {} ({} candidates, {} excluded)",
                request.getRequestId(), primary.getId(), strategy, available.size(), result.getExclusions().size());
        return result;
    }

    private List<ModelDescriptor> applyLatencyBound(InferenceRequest request,
                                                    List<ModelDescriptor> eligible,
                                                    RoutingDecision.RoutingDecisionBuilder decision) {
        Duration maxLatency = request.getMaxLatency();
        if (maxLatency == null) {
            return eligible;
        }

        List<ModelDescriptor> fastEnough = eligible.stream()
                .filter(model -> model.getLatencyClass().getNominalLatency().compareTo(maxLatency) <= 0)
                .toList();
        if (fastEnough.isEmpty()) {
            log.debug("No candidate meets max latency {} for request {}, ignoring the bound",
                    maxLatency, request.getRequestId());
            return eligible;
        }

        eligible.stream()
                .filter(model -> !fastEnough.contains(model))
                .forEach(model -> decision.exclusion(model.getId(), "latency class " + model.getLatencyClass()));
        return fastEnough;
    }

    private List<ModelDescriptor> applyProviderPin(InferenceRequest request,
                                                   List<ModelDescriptor> eligible,
                                                   RoutingDecision.RoutingDecisionBuilder decision) {
        Set<String> preferred = request.getPreferredProviders();
        List<ModelDescriptor> pinned = eligible.stream()
                .filter(model -> preferred.contains(model.getProvider()))
                .toList();
        if (pinned.isEmpty()) {
            log.debug("No preferred provider {} can serve request {}, ignoring the pin",
                    preferred, request.getRequestId());
            return eligible;
        }

        eligible.stream()
                .filter(model -> !pinned.contains(model))
                .forEach(model -> decision.exclusion(model.getId(), "provider " + model.getProvider() + " not pinned"));
        return pinned;
    }

    static Comparator<ModelDescriptor> ranking(RoutingStrategy strategy, InferenceRequest request) {
        int inputTokens = request.estimatedInputTokens();
        int outputTokens = request.getMaxOutputTokens();
        Comparator<ModelDescriptor> byCost = ranking(inputTokens, outputTokens);

        Comparator<ModelDescriptor> order;
        switch (strategy) {
            case LATENCY:
                order = Comparator.comparing(ModelDescriptor::getLatencyClass).thenComparing(byCost);
                break;
            case QUALITY:
                String dimension = request.getQualityDimension() != null
                        ? request.getQualityDimension()
                        : DEFAULT_QUALITY_DIMENSION;
                order = Comparator
                        .comparingDouble((ModelDescriptor model) -> -model.qualityScore(dimension))
                        .thenComparing(byCost);
                break;
            default:
                order = byCost;
                break;
        }

        Set<String> preferred = request.getPreferredProviders();
        if (preferred.isEmpty()) {
            return order;
        }
        return Comparator
                .comparing((ModelDescriptor model) -> !preferred.contains(model.getProvider()))
                .thenComparing(order);
    }

    static Comparator<ModelDescriptor> ranking(int inputTokens, int outputTokens) {
        return Comparator
                .comparingDouble((ModelDescriptor model) -> model.estimateCost(inputTokens, outputTokens))
                .thenComparing(ModelDescriptor::getLatencyClass)
                .thenComparing(ModelDescriptor::getProvider)
                .thenComparing(ModelDescriptor::getId);
    }

    private static Duration earliest(Duration current, Duration candidate) {
        if (candidate == null) {
            return current;
        }
        if (current == null || candidate.compareTo(current) < 0) {
            return candidate;
        }
        return current;
    }
}
