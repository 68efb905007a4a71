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
import me.golemcore.aigate.domain.model.CircuitBreakerSnapshot;
import me.golemcore.aigate.domain.model.ProviderDescriptor;
import me.golemcore.aigate.domain.service.ResilienceEventService;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide breakers keyed by {@code provider/model}, created lazily on
 * the first call for a pair and kept for the lifetime of the application.
 */
@Component
@Slf4j
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ResilienceEventService eventService;

    @Autowired
    public CircuitBreakerRegistry(AiGateProperties properties, Clock clock, ResilienceEventService eventService) {
        this(new CircuitBreakerConfig(properties.getCircuitBreaker().getFailureThreshold(),
                properties.getCircuitBreaker().getRecoveryTimeout()), clock, eventService);
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock, ResilienceEventService eventService) {
        this.config = config;
        this.clock = clock;
        this.eventService = eventService;
    }

    public CircuitBreaker forProvider(String providerId, String modelId) {
        return breakers.computeIfAbsent(key(providerId, modelId), k -> {
            log.debug("[Breaker] Creating breaker for {}", k);
            return new CircuitBreaker(providerId, modelId, config, clock, eventService);
        });
    }

    public CircuitBreaker forDescriptor(ProviderDescriptor descriptor) {
        return forProvider(descriptor.getProviderId(), descriptor.getModelId());
    }

    public Optional<CircuitBreaker> find(String providerId, String modelId) {
        return Optional.ofNullable(breakers.get(key(providerId, modelId)));
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::providerId)
                        .thenComparing(CircuitBreakerSnapshot::modelId))
                .toList();
    }

    /**
     * @return {@code false} when no breaker exists for the pair yet
     */
    public boolean reset(String providerId, String modelId) {
        CircuitBreaker breaker = breakers.get(key(providerId, modelId));
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    private static String key(String providerId, String modelId) {
        return providerId + "/" + modelId;
    }
}
