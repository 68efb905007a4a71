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

import me.golemcore.aigate.domain.exception.ProviderException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Thresholds of a breaker and the predicate deciding which exceptions count as
 * provider failures.
 */
public record CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout,
        Predicate<Throwable> failurePredicate) {

    public static final Predicate<Throwable> PROVIDER_FAILURES = e -> e instanceof ProviderException
            || e instanceof TimeoutException
            || e instanceof CancellationException
            || e instanceof IOException
            || e instanceof UncheckedIOException;

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive");
        }
        if (failurePredicate == null) {
            failurePredicate = PROVIDER_FAILURES;
        }
    }

    public CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout) {
        this(failureThreshold, recoveryTimeout, PROVIDER_FAILURES);
    }

    public boolean isCountedFailure(Throwable error) {
        return failurePredicate.test(error);
    }
}
