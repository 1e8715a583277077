package com.modelgateway.service.circuit;

import com.modelgateway.config.GatewayProperties;
import com.modelgateway.model.CircuitState;
import com.modelgateway.model.dto.CircuitStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Circuit state for a single provider. All methods synchronize on the
 * instance; different providers never share a lock.
 *
 * OPEN to HALF_OPEN and RECOVERING to CLOSED are time driven and applied
 * lazily whenever the state is read.
 *
 * The generation advances every time the circuit opens or is reset. Outcomes
 * carried by permits from an older generation are ignored.
 */
@Slf4j
class ProviderCircuit {

    // Hint returned while the single half-open probe is still in flight
    static final Duration PROBE_IN_FLIGHT_RETRY = Duration.ofSeconds(1);

    private final String provider;
    private final GatewayProperties.CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private final Deque<Instant> recentFailures = new ArrayDeque<>();
    private Instant lastTransition;
    private Instant nextProbeEligible;
    private Duration cooldown;
    private boolean probeInFlight;
    private long generation;
    private long totalFailures;
    private long totalSuccesses;

    ProviderCircuit(String provider, GatewayProperties.CircuitBreakerConfig config, Clock clock) {
        this.provider = provider;
        this.config = config;
        this.clock = clock;
        this.lastTransition = clock.instant();
        this.cooldown = config.getCooldown();
    }

    synchronized CircuitState state() {
        advance(clock.instant());
        return state;
    }

    synchronized boolean isAvailable() {
        advance(clock.instant());
        return switch (state) {
            case CLOSED, RECOVERING -> true;
            case HALF_OPEN -> !probeInFlight;
            case OPEN -> false;
        };
    }

    /**
     * Claim permission for one call. In HALF_OPEN only the first claimant gets
     * through; it holds the probe until its outcome is recorded or released.
     *
     * @return the permit, or null when the circuit rejects the call
     */
    synchronized CircuitPermit tryAcquirePermission() {
        advance(clock.instant());
        switch (state) {
            case CLOSED:
            case RECOVERING:
                return new CircuitPermit(provider, generation, false);
            case HALF_OPEN:
                if (probeInFlight) {
                    return null;
                }
                probeInFlight = true;
                return new CircuitPermit(provider, generation, true);
            default:
                return null;
        }
    }

    /**
     * Give back a permit whose call ended without a health signal (a permanent,
     * caller-side error).
     */
    synchronized void releasePermission(CircuitPermit permit) {
        if (permit.probe() && permit.generation() == generation && state == CircuitState.HALF_OPEN) {
            probeInFlight = false;
        }
    }

    synchronized void recordOutcome(CircuitPermit permit, boolean success) {
        Instant now = clock.instant();
        advance(now);
        if (permit.generation() != generation) {
            log.debug("Circuit {}: ignoring {} from generation {} (current {})",
                    provider, success ? "success" : "failure", permit.generation(), generation);
            return;
        }
        if (state == CircuitState.HALF_OPEN && !permit.probe()) {
            return;
        }
        if (success) {
            onSuccess(now);
        } else {
            onFailure(now);
        }
    }

    private void onSuccess(Instant now) {
        totalSuccesses++;
        consecutiveFailures = 0;
        consecutiveSuccesses++;

        switch (state) {
            case HALF_OPEN:
                probeInFlight = false;
                consecutiveSuccesses = 1;
                transition(CircuitState.RECOVERING, now);
                break;
            case RECOVERING:
                advance(now);
                break;
            default:
                break;
        }
    }

    private void onFailure(Instant now) {
        totalFailures++;
        consecutiveSuccesses = 0;
        consecutiveFailures++;

        switch (state) {
            case CLOSED:
                recentFailures.addLast(now);
                pruneWindow(now);
                if (consecutiveFailures >= config.getFailureThreshold()
                        || recentFailures.size() >= config.getFailureThreshold()) {
                    open(now, config.getCooldown());
                }
                break;
            case HALF_OPEN:
                probeInFlight = false;
                open(now, backedOffCooldown());
                break;
            case RECOVERING:
                open(now, backedOffCooldown());
                break;
            default:
                break;
        }
    }

    private void advance(Instant now) {
        if (state == CircuitState.OPEN && !now.isBefore(nextProbeEligible)) {
            probeInFlight = false;
            transition(CircuitState.HALF_OPEN, now);
        } else if (state == CircuitState.RECOVERING
                && consecutiveSuccesses >= config.getRecoveryMinSuccesses()
                && !now.isBefore(lastTransition.plus(config.getRecoveryWindow()))) {
            cooldown = config.getCooldown();
            recentFailures.clear();
            consecutiveFailures = 0;
            transition(CircuitState.CLOSED, now);
        }
    }

    private void open(Instant now, Duration openFor) {
        cooldown = openFor;
        generation++;
        nextProbeEligible = now.plus(openFor);
        recentFailures.clear();
        transition(CircuitState.OPEN, now);
    }

    private Duration backedOffCooldown() {
        long nextMillis = (long) (cooldown.toMillis() * config.getBackoffMultiplier());
        return Duration.ofMillis(Math.min(nextMillis, config.getMaxCooldown().toMillis()));
    }

    private void pruneWindow(Instant now) {
        Instant windowStart = now.minus(config.getFailureWindow());
        while (!recentFailures.isEmpty() && recentFailures.peekFirst().isBefore(windowStart)) {
            recentFailures.removeFirst();
        }
    }

    private void transition(CircuitState next, Instant now) {
        CircuitState previous = state;
        state = next;
        lastTransition = now;
        if (next == CircuitState.OPEN) {
            log.warn("Circuit {}: {} -> OPEN ({} consecutive failures, cooldown {})",
                    provider, previous, consecutiveFailures, cooldown);
        } else {
            log.info("Circuit {}: {} -> {}", provider, previous, next);
        }
    }

    synchronized Duration timeUntilRetry() {
        Instant now = clock.instant();
        advance(now);
        if (state == CircuitState.OPEN) {
            Duration remaining = Duration.between(now, nextProbeEligible);
            return remaining.isNegative() ? Duration.ZERO : remaining;
        }
        if (state == CircuitState.HALF_OPEN && probeInFlight) {
            return PROBE_IN_FLIGHT_RETRY;
        }
        return Duration.ZERO;
    }

    synchronized void reset() {
        cooldown = config.getCooldown();
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        probeInFlight = false;
        generation++;
        recentFailures.clear();
        nextProbeEligible = null;
        transition(CircuitState.CLOSED, clock.instant());
    }

    synchronized CircuitStatus status() {
        Instant now = clock.instant();
        advance(now);
        return CircuitStatus.builder()
                .provider(provider)
                .state(state)
                .consecutiveFailures(consecutiveFailures)
                .consecutiveSuccesses(consecutiveSuccesses)
                .lastTransition(lastTransition)
                .nextProbeEligible(state == CircuitState.OPEN ? nextProbeEligible : null)
                .currentCooldown(cooldown)
                .timeUntilRetry(timeUntilRetry())
                .totalFailures(totalFailures)
                .totalSuccesses(totalSuccesses)
                .build();
    }
}
