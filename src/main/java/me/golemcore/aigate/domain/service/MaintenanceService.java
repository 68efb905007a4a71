package me.golemcore.aigate.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.aigate.budget.CostGovernor;
import me.golemcore.aigate.cache.ResponseCache;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import me.golemcore.aigate.ratelimit.FixedWindowRateLimiter;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic cleanup of in-memory state: idle rate-limit buckets, expired cache
 * entries, ledgers of past periods and idle drift windows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaintenanceService {

    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final AiGateProperties properties;
    private final FixedWindowRateLimiter rateLimiter;
    private final ResponseCache cache;
    private final CostGovernor governor;

    private final ScheduledExecutorService maintenanceExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "aigate-maintenance");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        long intervalMs = properties.getMaintenance().getInterval().toMillis();
        maintenanceExecutor.scheduleAtFixedRate(this::runSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void destroy() {
        maintenanceExecutor.shutdownNow();
        try {
            maintenanceExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One cleanup pass.
     */
    public void runMaintenance() {
        int buckets = rateLimiter.evictIdle();
        int entries = cache.evictExpired();
        int ledgers = governor.evictStalePeriods();
        if (buckets + entries + ledgers > 0) {
            log.debug("[Maintenance] Evicted {} buckets, {} cache entries, {} ledgers", buckets, entries, ledgers);
        }
    }

    private void runSafely() {
        try {
            runMaintenance();
        } catch (RuntimeException e) {
            // A thrown exception would cancel the periodic task
            log.warn("[Maintenance] Cleanup pass failed", e);
        }
    }
}
