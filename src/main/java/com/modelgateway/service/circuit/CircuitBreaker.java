package com.modelgateway.service.circuit;

import com.modelgateway.config.GatewayProperties;
import com.modelgateway.model.CircuitState;
import com.modelgateway.model.dto.CircuitStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider failure isolation.
 *
 * <p>
 * The breaker only gates eligibility: it never retries a call itself. Callers
 * check {@link #isAvailable(String)} while ranking candidates, claim a call
 * with {@link #tryAcquirePermission(String)} right before invoking, and report
 * the result against the returned permit with
 * {@link #recordOutcome(CircuitPermit, boolean)}. Permanent, caller side errors
 * are not health signals and must be reported with
 * {@link #releasePermission(CircuitPermit)} instead.
 *
 * @see ProviderCircuit
 */
@Slf4j
public class CircuitBreaker {

    private final GatewayProperties.CircuitBreakerConfig config;
    private final Clock clock;
    private final Map<String, ProviderCircuit> circuits = new ConcurrentHashMap<>();

    public CircuitBreaker(GatewayProperties.CircuitBreakerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        log.info("CircuitBreaker initialized (threshold={}, window={}, cooldown={}, recovery={})",
                config.getFailureThreshold(), config.getFailureWindow(),
                config.getCooldown(), config.getRecoveryWindow());
    }

    public boolean isAvailable(String provider) {
        return circuit(provider).isAvailable();
    }

    public Optional<CircuitPermit> tryAcquirePermission(String provider) {
        return Optional.ofNullable(circuit(provider).tryAcquirePermission());
    }

    public void releasePermission(CircuitPermit permit) {
        circuit(permit.provider()).releasePermission(permit);
    }

    public void recordOutcome(CircuitPermit permit, boolean success) {
        circuit(permit.provider()).recordOutcome(permit, success);
    }

    /**
     * Zero when the provider is available now.
     */
    public Duration timeUntilRetry(String provider) {
        return circuit(provider).timeUntilRetry();
    }

    public CircuitState getState(String provider) {
        return circuit(provider).state();
    }

    public void reset(String provider) {
        circuit(provider).reset();
        log.info("Circuit {} reset", provider);
    }

    public CircuitStatus getStatus(String provider) {
        return circuit(provider).status();
    }

    public List<CircuitStatus> getStatuses() {
        return circuits.values().stream()
                .map(ProviderCircuit::status)
                .sorted(Comparator.comparing(CircuitStatus::getProvider))
                .toList();
    }

    private ProviderCircuit circuit(String provider) {
        return circuits.computeIfAbsent(provider, name -> new ProviderCircuit(name, config, clock));
    }
}
