package me.golemcore.resilience.governance;

import me.golemcore.resilience.domain.model.BreakerStatus;
import me.golemcore.resilience.domain.model.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration COOLDOWN = Duration.ofSeconds(30);

    @Test
    void closed_permitsCalls() {
        CircuitBreaker breaker = new CircuitBreaker("github", 3, COOLDOWN);

        BreakerDecision decision = breaker.tryAcquire(T0);

        assertTrue(decision.permitted());
        assertFalse(decision.probe());
        assertEquals(BreakerStatus.CLOSED, breaker.getStatus());
    }

    @Test
    void opensWhenConsecutiveFailuresReachThreshold() {
        CircuitBreaker breaker = new CircuitBreaker("github", 3, COOLDOWN);

        breaker.onFailure(false, T0);
        breaker.onFailure(false, T0);
        assertEquals(BreakerStatus.CLOSED, breaker.getStatus());
        breaker.onFailure(false, T0);

        CircuitBreakerState state = breaker.getState();
        assertEquals(BreakerStatus.OPEN, state.getStatus());
        assertEquals(T0, state.getOpenedAt());
        assertEquals(3, state.getConsecutiveFailures());
    }

    @Test
    void successResetsFailureCount() {
        CircuitBreaker breaker = new CircuitBreaker("github", 3, COOLDOWN);
        breaker.onFailure(false, T0);
        breaker.onFailure(false, T0);

        breaker.onSuccess(false);
        breaker.onFailure(false, T0);
        breaker.onFailure(false, T0);

        assertEquals(BreakerStatus.CLOSED, breaker.getStatus());
        assertEquals(2, breaker.getState().getConsecutiveFailures());
    }

    @Test
    void releaseLeavesFailureCountUntouched() {
        CircuitBreaker breaker = new CircuitBreaker("github", 2, COOLDOWN);
        breaker.onFailure(false, T0);

        breaker.onReleased(false);

        assertEquals(1, breaker.getState().getConsecutiveFailures());
    }

    @Test
    void thresholdOne_fullRecoveryCycle() {
        CircuitBreaker breaker = new CircuitBreaker("github", 1, COOLDOWN);

        breaker.onFailure(false, T0);
        assertEquals(BreakerStatus.OPEN, breaker.getStatus());

        BreakerDecision duringCooldown = breaker.tryAcquire(T0.plusSeconds(10));
        assertFalse(duringCooldown.permitted());
        assertEquals(Duration.ofSeconds(20), duringCooldown.retryAfter());

        BreakerDecision probe = breaker.tryAcquire(T0.plus(COOLDOWN));
        assertTrue(probe.permitted());
        assertTrue(probe.probe());
        assertEquals(BreakerStatus.HALF_OPEN, breaker.getStatus());

        assertFalse(breaker.tryAcquire(T0.plus(COOLDOWN)).permitted());

        breaker.onSuccess(true);
        assertEquals(BreakerStatus.CLOSED, breaker.getStatus());
        assertEquals(0, breaker.getState().getConsecutiveFailures());
        assertTrue(breaker.tryAcquire(T0.plus(COOLDOWN)).permitted());
    }

    @Test
    void failedProbeReopensAndRestartsCooldown() {
        CircuitBreaker breaker = new CircuitBreaker("github", 1, COOLDOWN);
        breaker.onFailure(false, T0);
        Instant probeTime = T0.plus(COOLDOWN).plusSeconds(5);
        breaker.tryAcquire(probeTime);

        breaker.onFailure(true, probeTime);

        CircuitBreakerState state = breaker.getState();
        assertEquals(BreakerStatus.OPEN, state.getStatus());
        assertEquals(probeTime, state.getOpenedAt());
        assertFalse(state.isProbeInFlight());
        assertFalse(breaker.tryAcquire(probeTime.plus(COOLDOWN).minusMillis(1)).permitted());
        assertTrue(breaker.tryAcquire(probeTime.plus(COOLDOWN)).probe());
    }

    @Test
    void releasedProbeFreesSlotWithoutTransition() {
        CircuitBreaker breaker = new CircuitBreaker("github", 1, COOLDOWN);
        breaker.onFailure(false, T0);
        breaker.tryAcquire(T0.plus(COOLDOWN));

        breaker.onReleased(true);

        assertEquals(BreakerStatus.HALF_OPEN, breaker.getStatus());
        assertFalse(breaker.getState().isProbeInFlight());
        assertTrue(breaker.tryAcquire(T0.plus(COOLDOWN)).probe());
    }

    @Test
    void staleFailureWhileOpenIsIgnored() {
        CircuitBreaker breaker = new CircuitBreaker("github", 1, COOLDOWN);
        breaker.onFailure(false, T0);

        breaker.onFailure(false, T0.plusSeconds(20));

        assertEquals(T0, breaker.getState().getOpenedAt());
    }

    @Test
    void constructor_rejectsZeroThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker("github", 0, COOLDOWN));
    }
}
