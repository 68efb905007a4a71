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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.aigate.domain.model.ResilienceEvent;
import me.golemcore.aigate.domain.model.ResilienceEventType;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import me.golemcore.aigate.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds timestamped {@link ResilienceEvent}s, logs them, keeps a bounded
 * history for the status API and publishes them on the event bus.
 *
 * <p>
 * Attributes carry identifiers only (provider, model, subject, tenant,
 * fingerprint prefix), never prompt text.
 */
@Service
@Slf4j
public class ResilienceEventService {

    private static final Set<ResilienceEventType> WARN_TYPES = Set.of(
            ResilienceEventType.BREAKER_OPENED,
            ResilienceEventType.BUDGET_EXCEEDED,
            ResilienceEventType.COST_DRIFT_DETECTED,
            ResilienceEventType.FALLBACK_SERVED);

    private final Clock clock;
    private final SpringEventBus eventBus;
    private final int historySize;
    private final Deque<ResilienceEvent> history = new ArrayDeque<>();

    public ResilienceEventService(Clock clock, SpringEventBus eventBus, AiGateProperties properties) {
        this.clock = clock;
        this.eventBus = eventBus;
        this.historySize = Math.max(1, properties.getEvents().getHistorySize());
    }

    public ResilienceEvent emit(ResilienceEventType type, Map<String, Object> attributes) {
        Map<String, Object> safeAttributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        ResilienceEvent event = ResilienceEvent.builder()
                .type(type)
                .timestamp(Instant.now(clock))
                .attributes(safeAttributes)
                .build();

        if (WARN_TYPES.contains(type)) {
            log.warn("[Events] {} {}", type, safeAttributes);
        } else {
            log.info("[Events] {} {}", type, safeAttributes);
        }

        synchronized (history) {
            history.addLast(event);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }

        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            // A failing listener must not break the call path
            log.warn("[Events] Listener failed for {}: {}", type, e.getMessage());
        }
        return event;
    }

    /**
     * Most recent events, newest first.
     */
    public List<ResilienceEvent> getRecentEvents(int limit) {
        List<ResilienceEvent> result = new ArrayList<>();
        synchronized (history) {
            Iterator<ResilienceEvent> it = history.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }
}
