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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.aigate.domain.exception.CircuitOpenException;
import me.golemcore.aigate.domain.exception.ProviderInvocationException;
import me.golemcore.aigate.domain.exception.ProviderTimeoutException;
import me.golemcore.aigate.domain.model.CircuitBreakerSnapshot;
import me.golemcore.aigate.domain.model.CircuitState;
import me.golemcore.aigate.domain.model.ResilienceEventType;
import me.golemcore.aigate.domain.service.ResilienceEventService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Failure-tracking guard around calls to one provider/model pair.
 *
 * <p>
 * State lives in a single immutable {@link CircuitBreakerState} replaced
 * under this instance's monitor, so the failure counter, the state and the
 * half-open trial gate always change together. Transitions are computed by
 * {@link CircuitTransitions}; the monitor is never held while the upstream
 * call runs.
 *
 * <p>
 * Every admitted call reports exactly one outcome, including calls that time
 * out or are cancelled by the caller.
 *
 * @since 1.0
 * @see CircuitBreakerRegistry
 */
@Slf4j
public class CircuitBreaker {

    private final String providerId;
    private final String modelId;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ResilienceEventService eventService;

    private CircuitBreakerState state = CircuitBreakerState.INITIAL;

    public CircuitBreaker(String providerId, String modelId, CircuitBreakerConfig config, Clock clock,
            ResilienceEventService eventService) {
        this.providerId = Objects.requireNonNull(providerId, "providerId must not be null");
        this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.eventService = eventService;
    }

    /**
     * Runs {@code operation} if the circuit admits it.
     *
     * <p>
     * The returned future completes with {@link CircuitOpenException} without
     * invoking the operation when the circuit is open or a half-open trial is
     * already in flight. Timeouts surface as {@link ProviderTimeoutException}.
     * Cancelling the returned future cancels the upstream future; the
     * cancellation is still recorded as a failure.
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation, Duration timeout) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        CircuitTransitions.Admission admission = acquire();
        if (!admission.permitted()) {
            log.debug("[Breaker] {}/{} refused call, retry after {}", providerId, modelId, admission.retryAfter());
            return CompletableFuture.failedFuture(
                    new CircuitOpenException(providerId, modelId, admission.retryAfter()));
        }
        boolean trial = admission.trial();
        if (trial) {
            log.info("[Breaker] {}/{} admitting half-open trial call", providerId, modelId);
        }

        CompletableFuture<T> upstream = startOperation(operation);
        CompletableFuture<T> result = new CompletableFuture<>();

        upstream.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((value, error) -> {
            if (error == null) {
                record(CallOutcome.SUCCESS, trial);
                result.complete(value);
                return;
            }
            Throwable failure = translate(unwrap(error), timeout);
            if (config.isCountedFailure(failure)) {
                record(CallOutcome.FAILURE, trial);
            } else {
                log.debug("[Breaker] {}/{} ignoring {} for failure accounting", providerId, modelId,
                        failure.getClass().getSimpleName());
                record(CallOutcome.IGNORED, trial);
            }
            result.completeExceptionally(failure);
        });

        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                upstream.cancel(true);
            }
        });
        return result;
    }

    /**
     * Current state with the time-driven transition applied.
     */
    public CircuitBreakerSnapshot snapshot() {
        CircuitBreakerState current = advance();
        return CircuitBreakerSnapshot.builder()
                .providerId(providerId)
                .modelId(modelId)
                .state(current.state())
                .consecutiveFailures(current.consecutiveFailures())
                .lastFailureTime(current.lastFailureTime())
                .trialInFlight(current.trialInFlight())
                .build();
    }

    public CircuitState getState() {
        return advance().state();
    }

    /**
     * Forces the circuit closed and clears the failure counter.
     */
    public void reset() {
        CircuitBreakerState before;
        synchronized (this) {
            before = state;
            state = CircuitBreakerState.INITIAL;
        }
        log.info("[Breaker] {}/{} manually reset", providerId, modelId);
        publishTransition(before, CircuitBreakerState.INITIAL);
    }

    public String getProviderId() {
        return providerId;
    }

    public String getModelId() {
        return modelId;
    }

    private CircuitTransitions.Admission acquire() {
        CircuitBreakerState before;
        CircuitTransitions.Admission admission;
        synchronized (this) {
            before = state;
            admission = CircuitTransitions.acquire(before, Instant.now(clock), config);
            state = admission.next();
        }
        publishTransition(before, admission.next());
        return admission;
    }

    private CircuitBreakerState advance() {
        CircuitBreakerState before;
        CircuitBreakerState after;
        synchronized (this) {
            before = state;
            after = CircuitTransitions.transition(before, Instant.now(clock), null, false, config);
            state = after;
        }
        publishTransition(before, after);
        return after;
    }

    private void record(CallOutcome outcome, boolean trial) {
        CircuitBreakerState before;
        CircuitBreakerState after;
        synchronized (this) {
            before = state;
            after = CircuitTransitions.transition(before, Instant.now(clock), outcome, trial, config);
            state = after;
        }
        if (outcome == CallOutcome.FAILURE) {
            log.debug("[Breaker] {}/{} failure {}/{}", providerId, modelId, after.consecutiveFailures(),
                    config.failureThreshold());
        }
        publishTransition(before, after);
    }

    private <T> CompletableFuture<T> startOperation(Supplier<CompletableFuture<T>> operation) {
        try {
            CompletableFuture<T> future = operation.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Operation returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Throwable translate(Throwable error, Duration timeout) {
        if (error instanceof TimeoutException) {
            return new ProviderTimeoutException(providerId, timeout, error);
        }
        if (error instanceof CancellationException) {
            return new ProviderInvocationException(providerId, "Call to " + providerId + " was cancelled", error);
        }
        return error;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void publishTransition(CircuitBreakerState before, CircuitBreakerState after) {
        if (before.state() == after.state() || eventService == null) {
            return;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("provider", providerId);
        attributes.put("model", modelId);
        switch (after.state()) {
        case OPEN -> {
            attributes.put("failureCount", after.consecutiveFailures());
            eventService.emit(ResilienceEventType.BREAKER_OPENED, attributes);
        }
        case HALF_OPEN -> eventService.emit(ResilienceEventType.BREAKER_HALF_OPENED, attributes);
        case CLOSED -> eventService.emit(ResilienceEventType.BREAKER_CLOSED, attributes);
        }
    }
}
