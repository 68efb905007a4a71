package me.golemcore.aigate.budget;

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

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aggregates estimated and actual cost per tenant over a rolling window.
 *
 * <p>
 * Drift is {@code |sum(actual) - sum(estimated)| / sum(estimated)}. A tenant
 * whose drift goes above the threshold is reported once, then re-armed when
 * its drift is back within the threshold.
 */
class DriftMonitor {

    private record Sample(Instant at, BigDecimal estimated, BigDecimal actual) {
    }

    private static final class TenantWindow {
        private final Deque<Sample> samples = new ArrayDeque<>();
        private BigDecimal estimated = BigDecimal.ZERO;
        private BigDecimal actual = BigDecimal.ZERO;
        private boolean drifting;

        void add(Sample sample) {
            samples.addLast(sample);
            estimated = estimated.add(sample.estimated());
            actual = actual.add(sample.actual());
        }

        void dropBefore(Instant cutoff) {
            while (!samples.isEmpty() && samples.peekFirst().at().isBefore(cutoff)) {
                Sample old = samples.removeFirst();
                estimated = estimated.subtract(old.estimated());
                actual = actual.subtract(old.actual());
            }
        }
    }

    private final Map<String, TenantWindow> windows = new ConcurrentHashMap<>();
    private final Duration window;
    private final BigDecimal threshold;

    DriftMonitor(Duration window, double thresholdPercent) {
        this.window = window;
        this.threshold = BigDecimal.valueOf(thresholdPercent).movePointLeft(2);
    }

    /**
     * Adds one settled call.
     *
     * @return the window drift ratio if the tenant just started drifting
     */
    Optional<BigDecimal> record(String tenantId, BigDecimal estimated, BigDecimal actual, Instant now) {
        BigDecimal[] alert = new BigDecimal[1];
        windows.compute(tenantId, (id, existing) -> {
            TenantWindow tenantWindow = existing != null ? existing : new TenantWindow();
            tenantWindow.add(new Sample(now, estimated, actual));
            tenantWindow.dropBefore(now.minus(window));
            alert[0] = evaluate(tenantWindow);
            return tenantWindow;
        });
        return Optional.ofNullable(alert[0]);
    }

    private BigDecimal evaluate(TenantWindow tenantWindow) {
        if (tenantWindow.estimated.signum() <= 0) {
            return null;
        }
        BigDecimal drift = tenantWindow.actual.subtract(tenantWindow.estimated).abs()
                .divide(tenantWindow.estimated, MathContext.DECIMAL64);
        boolean exceeds = drift.compareTo(threshold) > 0;
        if (exceeds && !tenantWindow.drifting) {
            tenantWindow.drifting = true;
            return drift;
        }
        if (!exceeds) {
            tenantWindow.drifting = false;
        }
        return null;
    }

    /**
     * @return number of tenants dropped because their window is empty
     */
    int evictIdle(Instant now) {
        Instant cutoff = now.minus(window);
        int before = windows.size();
        for (String tenantId : windows.keySet()) {
            windows.computeIfPresent(tenantId, (id, tenantWindow) -> {
                tenantWindow.dropBefore(cutoff);
                return tenantWindow.samples.isEmpty() ? null : tenantWindow;
            });
        }
        return Math.max(0, before - windows.size());
    }
}
