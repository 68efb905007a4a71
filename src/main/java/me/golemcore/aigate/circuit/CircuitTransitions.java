package me.golemcore.aigate.circuit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.aigate.domain.model.CircuitState;

import java.time.Duration;
import java.time.Instant;

/**
 * Pure transition functions of the breaker state machine.
 *
 * <pre>
 * CLOSED --failure x threshold--> OPEN --recovery timeout--> HALF_OPEN --success--> CLOSED
 * HALF_OPEN --failure--> OPEN
 * </pre>
 *
 * OPEN → HALF_OPEN is the only transition driven by time alone; every other
 * one needs a call outcome. Nothing here reads a clock or mutates state.
 */
public final class CircuitTransitions {

    private CircuitTransitions() {
    }

    /**
     * Computes the next state.
     *
     * @param outcome
     *            call outcome, or {@code null} to apply only the time-driven
     *            transition
     * @param trial
     *            whether the outcome belongs to the half-open trial call
     */
    public static CircuitBreakerState transition(CircuitBreakerState current, Instant now, CallOutcome outcome,
            boolean trial, CircuitBreakerConfig config) {
        if (outcome == null) {
            return advanceTime(current, now, config);
        }
        return switch (outcome) {
        case SUCCESS -> onSuccess(current, trial);
        case FAILURE -> onFailure(current, now, trial, config);
        case IGNORED -> trial && current.trialInFlight() ? current.withTrialInFlight(false) : current;
        };
    }

    /**
     * Decides whether a call may proceed and reserves the trial slot when the
     * call becomes the half-open probe.
     */
    public static Admission acquire(CircuitBreakerState current, Instant now, CircuitBreakerConfig config) {
        CircuitBreakerState state = advanceTime(current, now, config);
        return switch (state.state()) {
        case CLOSED -> new Admission(state, true, false, Duration.ZERO);
        case OPEN -> new Admission(state, false, false, remainingCoolDown(state, now, config));
        case HALF_OPEN -> state.trialInFlight()
                ? new Admission(state, false, false, Duration.ZERO)
                : new Admission(state.withTrialInFlight(true), true, true, Duration.ZERO);
        };
    }

    static Duration remainingCoolDown(CircuitBreakerState state, Instant now, CircuitBreakerConfig config) {
        if (state.lastFailureTime() == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(now, state.lastFailureTime().plus(config.recoveryTimeout()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private static CircuitBreakerState advanceTime(CircuitBreakerState current, Instant now,
            CircuitBreakerConfig config) {
        if (current.state() != CircuitState.OPEN || current.lastFailureTime() == null) {
            return current;
        }
        Instant reopenAt = current.lastFailureTime().plus(config.recoveryTimeout());
        if (now.isBefore(reopenAt)) {
            return current;
        }
        // A trial still running from the previous half-open phase keeps the slot
        return new CircuitBreakerState(CircuitState.HALF_OPEN, current.consecutiveFailures(),
                current.lastFailureTime(), current.trialInFlight());
    }

    private static CircuitBreakerState onSuccess(CircuitBreakerState current, boolean trial) {
        if (current.state() == CircuitState.OPEN) {
            // Straggler admitted before the circuit opened; the cool-down stands
            return trial ? current.withTrialInFlight(false) : current;
        }
        return new CircuitBreakerState(CircuitState.CLOSED, 0, current.lastFailureTime(), false);
    }

    private static CircuitBreakerState onFailure(CircuitBreakerState current, Instant now, boolean trial,
            CircuitBreakerConfig config) {
        int failures = current.consecutiveFailures() + 1;
        // Only the trial's own outcome releases the trial slot
        boolean trialInFlight = !trial && current.trialInFlight();
        if (current.state() == CircuitState.HALF_OPEN || current.state() == CircuitState.OPEN
                || failures >= config.failureThreshold()) {
            return new CircuitBreakerState(CircuitState.OPEN, failures, now, trialInFlight);
        }
        return new CircuitBreakerState(CircuitState.CLOSED, failures, now, current.trialInFlight());
    }

    /**
     * Result of {@link #acquire}: the state to store, whether the call may run,
     * whether it is the half-open trial, and how long until a retry can pass.
     */
    public record Admission(CircuitBreakerState next, boolean permitted, boolean trial, Duration retryAfter) {
    }
}
