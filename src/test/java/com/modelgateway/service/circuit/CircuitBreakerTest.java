package com.modelgateway.service.circuit;

import com.modelgateway.MutableClock;
import com.modelgateway.config.GatewayProperties;
import com.modelgateway.model.CircuitState;
import com.modelgateway.model.dto.CircuitStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CircuitBreaker.
 */
class CircuitBreakerTest {

    private static final String PROVIDER = "openai";

    private MutableClock clock;
    private GatewayProperties.CircuitBreakerConfig config;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        config = new GatewayProperties.CircuitBreakerConfig();
        config.setFailureThreshold(5);
        config.setFailureWindow(Duration.ofSeconds(60));
        config.setCooldown(Duration.ofSeconds(30));
        config.setBackoffMultiplier(2.0);
        config.setMaxCooldown(Duration.ofSeconds(90));
        config.setRecoveryWindow(Duration.ofSeconds(60));
        config.setRecoveryMinSuccesses(3);
        breaker = new CircuitBreaker(config, clock);
    }

    @Test
    void testStartsClosed() {
        assertEquals(CircuitState.CLOSED, breaker.getState(PROVIDER));
        assertTrue(breaker.isAvailable(PROVIDER));
        assertEquals(Duration.ZERO, breaker.timeUntilRetry(PROVIDER));
    }

    @Test
    void testOpensAfterConsecutiveFailures() {
        failTimes(4);
        assertEquals(CircuitState.CLOSED, breaker.getState(PROVIDER));

        call(false);

        assertEquals(CircuitState.OPEN, breaker.getState(PROVIDER));
        assertFalse(breaker.isAvailable(PROVIDER));
        assertTrue(breaker.tryAcquirePermission(PROVIDER).isEmpty());
        assertEquals(Duration.ofSeconds(30), breaker.timeUntilRetry(PROVIDER));
    }

    @Test
    void testOpensOnFailuresWithinWindow() {
        for (int i = 0; i < 5; i++) {
            call(false);
            if (i < 4) {
                call(true);
            }
            clock.advanceSeconds(5);
        }

        assertEquals(CircuitState.OPEN, breaker.getState(PROVIDER));
    }

    @Test
    void testFailuresOutsideWindowDoNotAccumulate() {
        for (int i = 0; i < 5; i++) {
            call(false);
            call(true);
            clock.advanceSeconds(20);
        }

        assertEquals(CircuitState.CLOSED, breaker.getState(PROVIDER));
    }

    @Test
    void testHalfOpenAllowsSingleProbe() {
        failTimes(5);

        clock.advanceSeconds(29);
        assertFalse(breaker.isAvailable(PROVIDER));
        assertEquals(Duration.ofSeconds(1), breaker.timeUntilRetry(PROVIDER));

        clock.advanceSeconds(1);
        assertEquals(CircuitState.HALF_OPEN, breaker.getState(PROVIDER));
        assertTrue(breaker.isAvailable(PROVIDER));

        CircuitPermit probe = breaker.tryAcquirePermission(PROVIDER).orElseThrow();
        assertTrue(probe.probe());
        assertTrue(breaker.tryAcquirePermission(PROVIDER).isEmpty());
        assertFalse(breaker.isAvailable(PROVIDER));
    }

    @Test
    void testFailedProbeReopensWithBackoff() {
        failTimes(5);
        clock.advanceSeconds(30);

        call(false);

        assertEquals(CircuitState.OPEN, breaker.getState(PROVIDER));
        assertEquals(Duration.ofSeconds(60), breaker.timeUntilRetry(PROVIDER));

        clock.advanceSeconds(60);
        call(false);

        // 120s capped at max cooldown
        assertEquals(Duration.ofSeconds(90), breaker.timeUntilRetry(PROVIDER));
    }

    @Test
    void testRecoveryClosesAfterWindowAndSuccesses() {
        failTimes(5);
        clock.advanceSeconds(30);
        call(true);

        assertEquals(CircuitState.RECOVERING, breaker.getState(PROVIDER));
        assertTrue(breaker.isAvailable(PROVIDER));

        call(true);
        call(true);
        assertEquals(CircuitState.RECOVERING, breaker.getState(PROVIDER));

        clock.advanceSeconds(60);
        assertEquals(CircuitState.CLOSED, breaker.getState(PROVIDER));
    }

    @Test
    void testRecoveryNeedsMinimumSuccesses() {
        failTimes(5);
        clock.advanceSeconds(30);
        call(true);

        clock.advanceSeconds(120);
        assertEquals(CircuitState.RECOVERING, breaker.getState(PROVIDER));

        call(true);
        call(true);
        assertEquals(CircuitState.CLOSED, breaker.getState(PROVIDER));
    }

    @Test
    void testFailureDuringRecoveryReopens() {
        failTimes(5);
        clock.advanceSeconds(30);
        call(true);

        call(false);

        assertEquals(CircuitState.OPEN, breaker.getState(PROVIDER));
        assertEquals(Duration.ofSeconds(60), breaker.timeUntilRetry(PROVIDER));
    }

    @Test
    void testClosingResetsCooldown() {
        failTimes(5);
        clock.advanceSeconds(30);
        call(false);
        clock.advanceSeconds(60);
        call(true);
        call(true);
        call(true);
        clock.advanceSeconds(60);
        assertEquals(CircuitState.CLOSED, breaker.getState(PROVIDER));

        failTimes(5);

        assertEquals(Duration.ofSeconds(30), breaker.timeUntilRetry(PROVIDER));
    }

    @Test
    void testReleasedProbeCanBeClaimedAgain() {
        failTimes(5);
        clock.advanceSeconds(30);
        CircuitPermit probe = breaker.tryAcquirePermission(PROVIDER).orElseThrow();

        breaker.releasePermission(probe);

        assertEquals(CircuitState.HALF_OPEN, breaker.getState(PROVIDER));
        assertTrue(breaker.tryAcquirePermission(PROVIDER).isPresent());
    }

    @Test
    void testLateSuccessLeavesCircuitHalfOpen() {
        CircuitPermit slowCall = breaker.tryAcquirePermission(PROVIDER).orElseThrow();
        failTimes(5);
        clock.advanceSeconds(31);
        CircuitPermit probe = breaker.tryAcquirePermission(PROVIDER).orElseThrow();

        breaker.recordOutcome(slowCall, true);

        assertEquals(CircuitState.HALF_OPEN, breaker.getState(PROVIDER));
        assertTrue(breaker.tryAcquirePermission(PROVIDER).isEmpty());

        breaker.recordOutcome(probe, true);
        assertEquals(CircuitState.RECOVERING, breaker.getState(PROVIDER));
    }

    @Test
    void testLateFailureLeavesCircuitHalfOpen() {
        CircuitPermit slowCall = breaker.tryAcquirePermission(PROVIDER).orElseThrow();
        failTimes(5);
        clock.advanceSeconds(31);
        breaker.tryAcquirePermission(PROVIDER).orElseThrow();

        breaker.recordOutcome(slowCall, false);
        breaker.releasePermission(slowCall);

        assertEquals(CircuitState.HALF_OPEN, breaker.getState(PROVIDER));
        assertTrue(breaker.tryAcquirePermission(PROVIDER).isEmpty());
        assertEquals(5, breaker.getStatus(PROVIDER).getTotalFailures());
    }

    @Test
    void testLateFailureDuringRecoveryIsIgnored() {
        CircuitPermit slowCall = breaker.tryAcquirePermission(PROVIDER).orElseThrow();
        failTimes(5);
        clock.advanceSeconds(30);
        call(true);

        breaker.recordOutcome(slowCall, false);

        assertEquals(CircuitState.RECOVERING, breaker.getState(PROVIDER));
    }

    @Test
    void testProvidersAreIndependent() {
        failTimes(5);

        assertFalse(breaker.isAvailable(PROVIDER));
        assertTrue(breaker.isAvailable("anthropic"));
    }

    @Test
    void testResetClosesCircuit() {
        failTimes(5);

        breaker.reset(PROVIDER);

        assertEquals(CircuitState.CLOSED, breaker.getState(PROVIDER));
        assertTrue(breaker.isAvailable(PROVIDER));
    }

    @Test
    void testStatusesReportCounters() {
        failTimes(5);
        breaker.recordOutcome(breaker.tryAcquirePermission("anthropic").orElseThrow(), true);

        List<CircuitStatus> statuses = breaker.getStatuses();

        assertEquals(2, statuses.size());
        assertEquals("anthropic", statuses.get(0).getProvider());
        assertEquals(1, statuses.get(0).getTotalSuccesses());
        CircuitStatus openai = statuses.get(1);
        assertEquals(CircuitState.OPEN, openai.getState());
        assertEquals(5, openai.getTotalFailures());
        assertEquals(Duration.ofSeconds(30), openai.getTimeUntilRetry());
        assertNotNull(openai.getNextProbeEligible());
    }

    private void call(boolean success) {
        CircuitPermit permit = breaker.tryAcquirePermission(PROVIDER).orElseThrow();
        breaker.recordOutcome(permit, success);
    }

    private void failTimes(int count) {
        for (int i = 0; i < count; i++) {
            call(false);
        }
    }
}
