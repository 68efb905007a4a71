package me.golemcore.aigate.circuit;

import me.golemcore.aigate.domain.model.CircuitState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CircuitTransitionsTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final CircuitBreakerConfig CONFIG = new CircuitBreakerConfig(3, Duration.ofSeconds(30));

    // ===== Failures =====

    @Test
    void shouldCountFailuresWhileClosed() {
        CircuitBreakerState state = CircuitTransitions.transition(CircuitBreakerState.INITIAL, T0,
                CallOutcome.FAILURE, false, CONFIG);

        assertEquals(CircuitState.CLOSED, state.state());
        assertEquals(1, state.consecutiveFailures());
        assertEquals(T0, state.lastFailureTime());
    }

    @Test
    void shouldOpenAtThreshold() {
        CircuitBreakerState state = CircuitBreakerState.INITIAL;
        for (int i = 0; i < 3; i++) {
            state = CircuitTransitions.transition(state, T0.plusSeconds(i), CallOutcome.FAILURE, false, CONFIG);
        }

        assertEquals(CircuitState.OPEN, state.state());
        assertEquals(3, state.consecutiveFailures());
        assertEquals(T0.plusSeconds(2), state.lastFailureTime());
    }

    @Test
    void shouldReopenOnTrialFailure() {
        CircuitBreakerState halfOpen = new CircuitBreakerState(CircuitState.HALF_OPEN, 3, T0, true);

        CircuitBreakerState state = CircuitTransitions.transition(halfOpen, T0.plusSeconds(40),
                CallOutcome.FAILURE, true, CONFIG);

        assertEquals(CircuitState.OPEN, state.state());
        assertEquals(T0.plusSeconds(40), state.lastFailureTime());
        assertFalse(state.trialInFlight());
    }

    // ===== Success =====

    @Test
    void shouldResetCounterOnSuccessWhileClosed() {
        CircuitBreakerState closed = new CircuitBreakerState(CircuitState.CLOSED, 2, T0, false);

        CircuitBreakerState state = CircuitTransitions.transition(closed, T0, CallOutcome.SUCCESS, false, CONFIG);

        assertEquals(CircuitState.CLOSED, state.state());
        assertEquals(0, state.consecutiveFailures());
    }

    @Test
    void shouldCloseOnTrialSuccess() {
        CircuitBreakerState halfOpen = new CircuitBreakerState(CircuitState.HALF_OPEN, 3, T0, true);

        CircuitBreakerState state = CircuitTransitions.transition(halfOpen, T0.plusSeconds(31),
                CallOutcome.SUCCESS, true, CONFIG);

        assertEquals(CircuitState.CLOSED, state.state());
        assertEquals(0, state.consecutiveFailures());
        assertFalse(state.trialInFlight());
    }

    @Test
    void shouldIgnoreLateSuccessWhileOpen() {
        CircuitBreakerState open = new CircuitBreakerState(CircuitState.OPEN, 3, T0, false);

        CircuitBreakerState state = CircuitTransitions.transition(open, T0.plusSeconds(1), CallOutcome.SUCCESS,
                false, CONFIG);

        assertSame(open, state);
    }

    // ===== Time =====

    @Test
    void shouldStayOpenBeforeRecoveryTimeout() {
        CircuitBreakerState open = new CircuitBreakerState(CircuitState.OPEN, 3, T0, false);

        CircuitBreakerState state = CircuitTransitions.transition(open, T0.plusSeconds(29), null, false, CONFIG);

        assertEquals(CircuitState.OPEN, state.state());
    }

    @Test
    void shouldHalfOpenOnceRecoveryTimeoutElapsed() {
        CircuitBreakerState open = new CircuitBreakerState(CircuitState.OPEN, 3, T0, false);

        CircuitBreakerState state = CircuitTransitions.transition(open, T0.plusSeconds(30), null, false, CONFIG);

        assertEquals(CircuitState.HALF_OPEN, state.state());
        assertEquals(3, state.consecutiveFailures());
    }

    // ===== Admission =====

    @Test
    void shouldRefuseWhileOpenWithRemainingCoolDown() {
        CircuitBreakerState open = new CircuitBreakerState(CircuitState.OPEN, 3, T0, false);

        CircuitTransitions.Admission admission = CircuitTransitions.acquire(open, T0.plusSeconds(10), CONFIG);

        assertFalse(admission.permitted());
        assertEquals(Duration.ofSeconds(20), admission.retryAfter());
    }

    @Test
    void shouldAdmitSingleTrialWhenHalfOpen() {
        CircuitBreakerState open = new CircuitBreakerState(CircuitState.OPEN, 3, T0, false);

        CircuitTransitions.Admission first = CircuitTransitions.acquire(open, T0.plusSeconds(31), CONFIG);
        CircuitTransitions.Admission second = CircuitTransitions.acquire(first.next(), T0.plusSeconds(31), CONFIG);

        assertTrue(first.permitted());
        assertTrue(first.trial());
        assertTrue(first.next().trialInFlight());
        assertFalse(second.permitted());
    }

    @Test
    void shouldReleaseTrialSlotOnIgnoredOutcome() {
        CircuitBreakerState halfOpen = new CircuitBreakerState(CircuitState.HALF_OPEN, 3, T0, true);

        CircuitBreakerState state = CircuitTransitions.transition(halfOpen, T0.plusSeconds(31),
                CallOutcome.IGNORED, true, CONFIG);

        assertEquals(CircuitState.HALF_OPEN, state.state());
        assertFalse(state.trialInFlight());
    }

    @Test
    void shouldKeepTrialSlotWhenEarlierCallFailsDuringHalfOpen() {
        CircuitBreakerState halfOpen = new CircuitBreakerState(CircuitState.HALF_OPEN, 3, T0, true);

        CircuitBreakerState reopened = CircuitTransitions.transition(halfOpen, T0.plusSeconds(31),
                CallOutcome.FAILURE, false, CONFIG);

        assertEquals(CircuitState.OPEN, reopened.state());
        assertTrue(reopened.trialInFlight());

        CircuitTransitions.Admission afterCoolDown = CircuitTransitions.acquire(reopened, T0.plusSeconds(62),
                CONFIG);
        assertEquals(CircuitState.HALF_OPEN, afterCoolDown.next().state());
        assertFalse(afterCoolDown.permitted());

        CircuitBreakerState trialDone = CircuitTransitions.transition(afterCoolDown.next(), T0.plusSeconds(63),
                CallOutcome.FAILURE, true, CONFIG);
        assertFalse(trialDone.trialInFlight());
        assertTrue(CircuitTransitions.acquire(trialDone, T0.plusSeconds(94), CONFIG).permitted());
    }

    @Test
    void shouldReleaseTrialSlotWhenTrialSucceedsAfterReopen() {
        CircuitBreakerState open = new CircuitBreakerState(CircuitState.OPEN, 4, T0, true);

        CircuitBreakerState state = CircuitTransitions.transition(open, T0.plusSeconds(1), CallOutcome.SUCCESS,
                true, CONFIG);

        assertEquals(CircuitState.OPEN, state.state());
        assertFalse(state.trialInFlight());
    }
}
