package me.golemcore.aigate.adapter.inbound.web.controller;

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
import me.golemcore.aigate.adapter.inbound.web.dto.BudgetStatusResponse;
import me.golemcore.aigate.adapter.inbound.web.dto.CacheStatsResponse;
import me.golemcore.aigate.budget.CostGovernor;
import me.golemcore.aigate.cache.ResponseCache;
import me.golemcore.aigate.circuit.CircuitBreakerRegistry;
import me.golemcore.aigate.domain.model.CacheStats;
import me.golemcore.aigate.domain.model.CircuitBreakerSnapshot;
import me.golemcore.aigate.domain.model.FallbackStats;
import me.golemcore.aigate.domain.model.ResilienceEvent;
import me.golemcore.aigate.domain.service.ResilienceEventService;
import me.golemcore.aigate.routing.FallbackGenerator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Operational endpoints: breaker state, budgets, cache and fallback
 * statistics, recent resilience events.
 */
@RestController
@RequestMapping("/api/resilience")
@RequiredArgsConstructor
@Slf4j
public class ResilienceController {

    private static final int MAX_EVENTS = 500;

    private final CircuitBreakerRegistry breakerRegistry;
    private final CostGovernor costGovernor;
    private final ResponseCache responseCache;
    private final FallbackGenerator fallbackGenerator;
    private final ResilienceEventService eventService;

    @GetMapping("/breakers")
    public Mono<ResponseEntity<List<CircuitBreakerSnapshot>>> getBreakers() {
        return Mono.just(ResponseEntity.ok(breakerRegistry.snapshots()));
    }

    @PostMapping("/breakers/{providerId}/{modelId}/reset")
    public Mono<ResponseEntity<Map<String, Object>>> resetBreaker(@PathVariable String providerId,
            @PathVariable String modelId) {
        if (!breakerRegistry.reset(providerId, modelId)) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        log.info("[Breaker] Manual reset of {}/{}", providerId, modelId);
        return Mono.just(ResponseEntity.ok(Map.of("providerId", providerId, "modelId", modelId, "state", "CLOSED")));
    }

    @GetMapping("/budgets/{tenantId}")
    public Mono<ResponseEntity<BudgetStatusResponse>> getBudget(@PathVariable String tenantId) {
        return Mono.just(ResponseEntity.ok(BudgetStatusResponse.from(costGovernor.getStatus(tenantId))));
    }

    @PostMapping("/budgets/{tenantId}/override")
    public Mono<ResponseEntity<BudgetStatusResponse>> setOverride(@PathVariable String tenantId,
            @RequestParam boolean enabled) {
        costGovernor.setOverride(tenantId, enabled);
        return Mono.just(ResponseEntity.ok(BudgetStatusResponse.from(costGovernor.getStatus(tenantId))));
    }

    @PostMapping("/budgets/{tenantId}/reset")
    public Mono<ResponseEntity<BudgetStatusResponse>> resetBudget(@PathVariable String tenantId) {
        costGovernor.resetPeriod(tenantId);
        return Mono.just(ResponseEntity.ok(BudgetStatusResponse.from(costGovernor.getStatus(tenantId))));
    }

    @GetMapping("/cache/stats")
    public Mono<ResponseEntity<CacheStatsResponse>> getCacheStats() {
        CacheStats stats = responseCache.getStats();
        CacheStatsResponse response = CacheStatsResponse.builder()
                .hits(stats.getHits())
                .misses(stats.getMisses())
                .puts(stats.getPuts())
                .evictions(stats.getEvictions())
                .size(stats.getSize())
                .hitRate(stats.getHitRate())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @DeleteMapping("/cache")
    public Mono<ResponseEntity<Map<String, Integer>>> clearCache() {
        int removed = responseCache.invalidateAll();
        return Mono.just(ResponseEntity.ok(Map.of("removed", removed)));
    }

    @DeleteMapping("/cache/{fingerprint}")
    public Mono<ResponseEntity<Void>> invalidate(@PathVariable String fingerprint) {
        if (!responseCache.invalidate(fingerprint)) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/fallbacks/stats")
    public Mono<ResponseEntity<FallbackStats>> getFallbackStats() {
        return Mono.just(ResponseEntity.ok(fallbackGenerator.getStats()));
    }

    @GetMapping("/events")
    public Mono<ResponseEntity<List<ResilienceEvent>>> getEvents(@RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_EVENTS));
        return Mono.just(ResponseEntity.ok(eventService.getRecentEvents(bounded)));
    }
}
