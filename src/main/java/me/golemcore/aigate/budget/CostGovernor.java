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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.aigate.domain.exception.BudgetExceededException;
import me.golemcore.aigate.domain.model.BudgetDecision;
import me.golemcore.aigate.domain.model.BudgetReservation;
import me.golemcore.aigate.domain.model.BudgetStatus;
import me.golemcore.aigate.domain.model.ResilienceEventType;
import me.golemcore.aigate.domain.service.ResilienceEventService;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Budget enforcement per tenant and billing period (calendar month in the
 * configured zone).
 *
 * <p>
 * Authorization is optimistic: the estimate is debited from
 * {@code spentEstimated} right away and replaced by the real cost when the
 * call settles, or reversed when it fails. Every reservation is settled at
 * most once; repeated settlements are ignored.
 *
 * <p>
 * Events:
 * <ul>
 * <li>{@code BUDGET_EXCEEDED} - a call was denied, or a settlement was clamped
 * at the hard cap</li>
 * <li>{@code BUDGET_SOFT_CAP_REACHED} - once per period</li>
 * <li>{@code COST_DRIFT_DETECTED} - aggregated drift left the threshold</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@Slf4j
public class CostGovernor {

    private static final String LOG_PREFIX = "[Budget]";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AiGateProperties properties;
    private final Clock clock;
    private final ResilienceEventService eventService;
    private final DriftMonitor driftMonitor;
    private final ZoneId zone;

    private final Map<String, BudgetLedger> ledgers = new ConcurrentHashMap<>();

    public CostGovernor(AiGateProperties properties, Clock clock, ResilienceEventService eventService) {
        this.properties = properties;
        this.clock = clock;
        this.eventService = eventService;
        this.driftMonitor = new DriftMonitor(properties.getBudget().getDriftWindow(),
                properties.getBudget().getDriftThresholdPercent());
        this.zone = ZoneId.of(properties.getBudget().getZone());
    }

    public BudgetDecision authorize(String tenantId, BigDecimal estimatedCost) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (estimatedCost == null || estimatedCost.signum() < 0) {
            throw new IllegalArgumentException("estimatedCost must not be negative");
        }

        BudgetLedger ledger = currentLedger(tenantId);
        String reservationId = UUID.randomUUID().toString();
        BudgetLedger.Admission admission = ledger.reserve(reservationId, estimatedCost);
        if (admission == BudgetLedger.Admission.ALLOWED) {
            return BudgetDecision.allowed(
                    new BudgetReservation(reservationId, tenantId, ledger.getPeriod(), estimatedCost));
        }

        String reason = admission == BudgetLedger.Admission.EXHAUSTED
                ? "Budget exhausted for " + ledger.getPeriod()
                : "Estimated cost would exceed hard cap for " + ledger.getPeriod();
        log.debug("{} Denied tenant {} (estimate {}): {}", LOG_PREFIX, tenantId, estimatedCost, reason);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("tenant", tenantId);
        attributes.put("period", ledger.getPeriod().toString());
        attributes.put("estimatedCost", estimatedCost);
        eventService.emit(ResilienceEventType.BUDGET_EXCEEDED, attributes);
        return BudgetDecision.denied(reason);
    }

    public BudgetReservation authorizeOrThrow(String tenantId, BigDecimal estimatedCost) {
        BudgetDecision decision = authorize(tenantId, estimatedCost);
        if (!decision.allowed()) {
            throw new BudgetExceededException(tenantId, decision.reason());
        }
        return decision.reservation();
    }

    /**
     * Settles a reservation with the cost reported by the provider.
     *
     * @return {@code false} if the reservation was already settled or its
     *         ledger is gone
     */
    public boolean recordActual(BudgetReservation reservation, BigDecimal actualCost, long actualTokens) {
        if (actualCost == null || actualCost.signum() < 0) {
            throw new IllegalArgumentException("actualCost must not be negative");
        }
        BudgetLedger ledger = ledgerOf(reservation);
        if (ledger == null) {
            return false;
        }

        BudgetLedger.Settlement settlement = ledger.settle(reservation.id(), actualCost, Math.max(0, actualTokens));
        if (!settlement.applied()) {
            log.debug("{} Reservation {} already settled", LOG_PREFIX, reservation.id());
            return false;
        }

        if (settlement.clampedExcess().signum() > 0) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("tenant", reservation.tenantId());
            attributes.put("period", reservation.period().toString());
            attributes.put("overage", settlement.clampedExcess());
            eventService.emit(ResilienceEventType.BUDGET_EXCEEDED, attributes);
        }
        if (settlement.softCapCrossed()) {
            BudgetStatus status = ledger.toStatus();
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("tenant", reservation.tenantId());
            attributes.put("period", reservation.period().toString());
            attributes.put("spentActual", status.getSpentActual());
            attributes.put("softCap", status.getSoftCap());
            eventService.emit(ResilienceEventType.BUDGET_SOFT_CAP_REACHED, attributes);
        }

        Optional<BigDecimal> drift = driftMonitor.record(reservation.tenantId(), reservation.estimatedCost(),
                actualCost, Instant.now(clock));
        drift.ifPresent(ratio -> {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("tenant", reservation.tenantId());
            attributes.put("driftPercent", ratio.multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP));
            attributes.put("thresholdPercent", properties.getBudget().getDriftThresholdPercent());
            eventService.emit(ResilienceEventType.COST_DRIFT_DETECTED, attributes);
        });
        return true;
    }

    /**
     * Zero-cost settlement for a call that failed or was abandoned.
     */
    public boolean recordFailure(BudgetReservation reservation) {
        BudgetLedger ledger = ledgerOf(reservation);
        if (ledger == null) {
            return false;
        }
        boolean released = ledger.release(reservation.id());
        if (released) {
            log.debug("{} Reversed estimate {} for tenant {}", LOG_PREFIX, reservation.estimatedCost(),
                    reservation.tenantId());
        }
        return released;
    }

    public BudgetStatus getStatus(String tenantId) {
        return currentLedger(tenantId).toStatus();
    }

    /**
     * Lifts (or restores) the hard cap for the current period.
     */
    public void setOverride(String tenantId, boolean enabled) {
        currentLedger(tenantId).setOverride(enabled);
        log.info("{} Override for tenant {} {}", LOG_PREFIX, tenantId, enabled ? "enabled" : "disabled");
    }

    /**
     * Starts a fresh ledger for the current period. Reservations issued
     * against the old ledger are ignored when they settle.
     */
    public void resetPeriod(String tenantId) {
        YearMonth period = currentPeriod();
        ledgers.put(key(tenantId, period), newLedger(tenantId, period));
        log.info("{} Reset ledger of tenant {} for {}", LOG_PREFIX, tenantId, period);
    }

    /**
     * Drops ledgers of past periods with nothing left to settle, and idle
     * drift windows.
     */
    public int evictStalePeriods() {
        YearMonth current = currentPeriod();
        int before = ledgers.size();
        for (String key : ledgers.keySet()) {
            ledgers.computeIfPresent(key, (k, ledger) -> ledger.getPeriod().isBefore(current) && !ledger.hasPending()
                    ? null
                    : ledger);
        }
        int removed = Math.max(0, before - ledgers.size());
        int driftRemoved = driftMonitor.evictIdle(Instant.now(clock));
        if (removed > 0 || driftRemoved > 0) {
            log.debug("{} Evicted {} stale ledgers and {} idle drift windows", LOG_PREFIX, removed, driftRemoved);
        }
        return removed;
    }

    YearMonth currentPeriod() {
        return YearMonth.from(Instant.now(clock).atZone(zone));
    }

    private BudgetLedger currentLedger(String tenantId) {
        YearMonth period = currentPeriod();
        return ledgers.computeIfAbsent(key(tenantId, period), k -> newLedger(tenantId, period));
    }

    private BudgetLedger ledgerOf(BudgetReservation reservation) {
        if (reservation == null) {
            throw new IllegalArgumentException("reservation must not be null");
        }
        BudgetLedger ledger = ledgers.get(key(reservation.tenantId(), reservation.period()));
        if (ledger == null) {
            log.debug("{} No ledger for tenant {} in {}", LOG_PREFIX, reservation.tenantId(), reservation.period());
        }
        return ledger;
    }

    private BudgetLedger newLedger(String tenantId, YearMonth period) {
        AiGateProperties.TenantProperties tenant = properties.getTenants().get(tenantId);
        BigDecimal hardCap = tenant != null && tenant.getHardCap() != null
                ? tenant.getHardCap()
                : properties.getBudget().getDefaultHardCap();
        int softCapPercent = tenant != null && tenant.getSoftCapPercent() != null
                ? tenant.getSoftCapPercent()
                : properties.getBudget().getSoftCapPercent();
        BigDecimal softCap = hardCap.multiply(BigDecimal.valueOf(softCapPercent))
                .divide(HUNDRED, CostEstimator.COST_SCALE, RoundingMode.HALF_UP);
        return new BudgetLedger(tenantId, period, hardCap, softCap);
    }

    private static String key(String tenantId, YearMonth period) {
        return tenantId + "|" + period;
    }
}
