package me.golemcore.aigate.ratelimit;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.aigate.domain.model.BucketState;
import me.golemcore.aigate.domain.model.RateLimitResult;
import me.golemcore.aigate.domain.model.ResilienceEventType;
import me.golemcore.aigate.domain.service.ResilienceEventService;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window rate limiter with one tier per operation class.
 *
 * <p>
 * Default tiers (configurable under {@code aigate.rate-limit.tiers}):
 * <ul>
 * <li><b>help</b> - 20 per minute</li>
 * <li><b>analysis</b> - 5 per minute</li>
 * <li><b>recommendations</b> - 10 per minute</li>
 * <li><b>quick-check</b> - 30 per minute</li>
 * <li><b>streaming</b> - 3 concurrent</li>
 * </ul>
 *
 * <p>
 * Maintains a separate {@link FixedWindowCounter} or
 * {@link ConcurrencyLimiter} per {@code subject:operationClass} key. Each
 * check runs inside the map's per-key {@code compute}, so increments on one
 * key are linearizable and never race with eviction. Different keys never
 * contend.
 *
 * <p>
 * Can be disabled via {@code aigate.rate-limit.enabled=false}.
 *
 * @since 1.0
 * @see FixedWindowCounter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {

    private final AiGateProperties properties;
    private final Clock clock;
    private final ResilienceEventService eventService;

    private final Map<String, ConfiguredCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, ConfiguredConcurrency> concurrencyLimiters = new ConcurrentHashMap<>();

    @Override
    public RateLimitResult checkAndIncrement(String subjectId, String operationClass) {
        requireText(subjectId, "subjectId");
        requireText(operationClass, "operationClass");

        if (!properties.getRateLimit().isEnabled()) {
            return RateLimitResult.allowed(Long.MAX_VALUE, Long.MAX_VALUE);
        }

        AiGateProperties.TierProperties tier = properties.getRateLimit().getTiers().get(operationClass);
        if (tier == null) {
            throw new IllegalArgumentException("Unknown operation class: " + operationClass);
        }

        String key = key(subjectId, operationClass);
        RateLimitResult result = tier.isConcurrent()
                ? acquireSlot(key, tier.getMaxConcurrent())
                : countRequest(key, tier.getLimit(), tier.getWindow());

        if (!result.isAllowed()) {
            log.debug("[RateLimit] Denied {} for subject {} ({})", operationClass, subjectId, result.getReason());
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("subject", subjectId);
            attributes.put("operationClass", operationClass);
            attributes.put("limit", result.getLimit());
            eventService.emit(ResilienceEventType.RATE_LIMIT_EXCEEDED, attributes);
        }
        return result;
    }

    @Override
    public BucketState getBucketState(String subjectId, String operationClass) {
        ConfiguredCounter configured = counters.get(key(subjectId, operationClass));
        if (configured == null) {
            return null;
        }
        return configured.counter().getState(key(subjectId, operationClass));
    }

    /**
     * In-flight calls held by a subject on a concurrency tier.
     */
    public int getActiveCount(String subjectId, String operationClass) {
        ConfiguredConcurrency configured = concurrencyLimiters.get(key(subjectId, operationClass));
        return configured != null ? configured.limiter().getActiveCount() : 0;
    }

    /**
     * Drops counters whose window is over and concurrency limiters with no
     * call in flight.
     *
     * @return number of entries removed
     */
    public int evictIdle() {
        Instant now = Instant.now(clock);
        int before = counters.size() + concurrencyLimiters.size();
        for (String key : counters.keySet()) {
            counters.computeIfPresent(key, (k, existing) -> existing.counter().isExpired(now) ? null : existing);
        }
        for (String key : concurrencyLimiters.keySet()) {
            concurrencyLimiters.computeIfPresent(key,
                    (k, existing) -> existing.limiter().getActiveCount() == 0 ? null : existing);
        }
        int removed = before - (counters.size() + concurrencyLimiters.size());
        if (removed > 0) {
            log.debug("[RateLimit] Evicted {} idle buckets", removed);
        }
        return Math.max(removed, 0);
    }

    private RateLimitResult countRequest(String key, int limit, Duration window) {
        Instant now = Instant.now(clock);
        RateLimitResult[] result = new RateLimitResult[1];
        counters.compute(key, (k, existing) -> {
            ConfiguredCounter configured = existing;
            if (configured == null || configured.limit() != limit || !configured.window().equals(window)) {
                configured = new ConfiguredCounter(new FixedWindowCounter(limit, window), limit, window);
            }
            result[0] = configured.counter().checkAndIncrement(now);
            return configured;
        });
        return result[0];
    }

    private RateLimitResult acquireSlot(String key, int maxConcurrent) {
        RateLimitResult[] result = new RateLimitResult[1];
        concurrencyLimiters.compute(key, (k, existing) -> {
            ConfiguredConcurrency configured = existing;
            if (configured == null || configured.maxConcurrent() != maxConcurrent) {
                configured = new ConfiguredConcurrency(new ConcurrencyLimiter(maxConcurrent), maxConcurrent);
            }
            result[0] = configured.limiter().tryAcquire();
            return configured;
        });
        return result[0];
    }

    private static String key(String subjectId, String operationClass) {
        return operationClass + ":" + subjectId;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private record ConfiguredCounter(FixedWindowCounter counter, int limit, Duration window) {
    }

    private record ConfiguredConcurrency(ConcurrencyLimiter limiter, int maxConcurrent) {
    }
}
