package me.golemcore.aigate.routing;

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
import me.golemcore.aigate.domain.model.DegradationReason;
import me.golemcore.aigate.domain.model.FallbackContent;
import me.golemcore.aigate.domain.model.FallbackStats;
import me.golemcore.aigate.domain.model.GenerationRequest;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Produces the degraded-but-useful answer served when no provider answered.
 *
 * <p>
 * Resolution order:
 * <ol>
 * <li>a static template for the task type (see
 * {@link FallbackTemplateCatalog})</li>
 * <li>the service-unavailable notice, when providers are down</li>
 * <li>a basic message naming the task and the reason</li>
 * </ol>
 * Never returns empty text and never echoes the prompt or the failure detail.
 */
@Component
@Slf4j
public class FallbackGenerator {

    static final String SOURCE_TEMPLATE = "template";
    static final String SOURCE_SERVICE_STATUS = "service_status";
    static final String SOURCE_BASIC = "basic";

    static final double BASIC_CONFIDENCE = 0.4;

    private static final Set<DegradationReason> OUTAGE_REASONS = EnumSet.of(
            DegradationReason.CIRCUITS_OPEN,
            DegradationReason.PROVIDERS_FAILED,
            DegradationReason.NO_PROVIDERS);

    private final FallbackTemplateCatalog templates;

    private final AtomicLong total = new AtomicLong();
    private final Map<String, AtomicLong> byReason = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> byTaskType = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> bySource = new ConcurrentHashMap<>();

    public FallbackGenerator(FallbackTemplateCatalog templates) {
        this.templates = templates;
    }

    public FallbackContent generate(GenerationRequest request, DegradationReason reason, Throwable cause) {
        if (cause != null) {
            log.debug("[Fallback] {} for task {} caused by {}", reason.getCode(), request.getTaskType(),
                    cause.getClass().getSimpleName());
        }

        FallbackContent content = fromTemplate(request)
                .or(() -> serviceUnavailable(reason))
                .orElseGet(() -> basic(request.getTaskType(), reason));

        total.incrementAndGet();
        increment(byReason, reason.getCode());
        increment(byTaskType, request.getTaskType() != null ? request.getTaskType() : "unknown");
        increment(bySource, content.source().startsWith(SOURCE_TEMPLATE) ? SOURCE_TEMPLATE : content.source());
        return content;
    }

    public FallbackStats getStats() {
        return FallbackStats.builder()
                .totalFallbacks(total.get())
                .byReason(snapshot(byReason))
                .byTaskType(snapshot(byTaskType))
                .bySource(snapshot(bySource))
                .build();
    }

    private Optional<FallbackContent> fromTemplate(GenerationRequest request) {
        return templates.find(request.getTaskType(), request.getContext())
                .map(match -> new FallbackContent(match.template().getText(), match.template().getConfidence(),
                        SOURCE_TEMPLATE + ":" + match.key()));
    }

    private Optional<FallbackContent> serviceUnavailable(DegradationReason reason) {
        if (!OUTAGE_REASONS.contains(reason)) {
            return Optional.empty();
        }
        return templates.getServiceUnavailable()
                .map(template -> new FallbackContent(template.getText(), template.getConfidence(),
                        SOURCE_SERVICE_STATUS));
    }

    private static FallbackContent basic(String taskType, DegradationReason reason) {
        String task = taskType != null && !taskType.isBlank() ? taskType : "requested";
        String text = "The " + task + " service is temporarily unavailable (" + reason.getMessage()
                + "). Please try again later or contact support.";
        return new FallbackContent(text, BASIC_CONFIDENCE, SOURCE_BASIC);
    }

    private static void increment(Map<String, AtomicLong> counters, String key) {
        counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    private static Map<String, Long> snapshot(Map<String, AtomicLong> counters) {
        Map<String, Long> copy = new TreeMap<>();
        counters.forEach((key, value) -> copy.put(key, value.get()));
        return copy;
    }
}
