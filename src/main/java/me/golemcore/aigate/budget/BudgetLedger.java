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

import me.golemcore.aigate.domain.model.BudgetStatus;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.Map;

/**
 * Spending of one tenant in one billing period. All methods lock the ledger
 * instance, so a debit and its settlement are never interleaved with another
 * call for the same tenant and period.
 */
class BudgetLedger {

    enum Admission {
        ALLOWED, EXHAUSTED, WOULD_EXCEED
    }

    /**
     * What a settlement changed, for events raised outside the lock.
     */
    record Settlement(boolean applied, BigDecimal clampedExcess, boolean softCapCrossed) {

        static final Settlement IGNORED = new Settlement(false, BigDecimal.ZERO, false);
    }

    private final String tenantId;
    private final YearMonth period;
    private final BigDecimal hardCap;
    private final BigDecimal softCap;

    private final Map<String, BigDecimal> pending = new HashMap<>();
    private BigDecimal spentEstimated = BigDecimal.ZERO;
    private BigDecimal spentActual = BigDecimal.ZERO;
    private BigDecimal overage = BigDecimal.ZERO;
    private long actualTokens;
    private long settledCalls;
    private boolean override;
    private boolean softCapNotified;

    BudgetLedger(String tenantId, YearMonth period, BigDecimal hardCap, BigDecimal softCap) {
        this.tenantId = tenantId;
        this.period = period;
        this.hardCap = hardCap;
        this.softCap = softCap;
    }

    synchronized Admission reserve(String reservationId, BigDecimal estimatedCost) {
        if (!override) {
            if (spentActual.compareTo(hardCap) >= 0) {
                return Admission.EXHAUSTED;
            }
            if (spentEstimated.add(estimatedCost).compareTo(hardCap) > 0) {
                return Admission.WOULD_EXCEED;
            }
        }
        spentEstimated = spentEstimated.add(estimatedCost);
        pending.put(reservationId, estimatedCost);
        return Admission.ALLOWED;
    }

    /**
     * Replaces the provisional estimate with the real cost. Actual spending is
     * clamped at the hard cap; anything above it goes to {@code overage}.
     */
    synchronized Settlement settle(String reservationId, BigDecimal actualCost, long tokens) {
        BigDecimal estimated = pending.remove(reservationId);
        if (estimated == null) {
            return Settlement.IGNORED;
        }
        spentEstimated = spentEstimated.subtract(estimated).add(actualCost);

        BigDecimal next = spentActual.add(actualCost);
        BigDecimal excess = BigDecimal.ZERO;
        if (next.compareTo(hardCap) > 0) {
            excess = next.subtract(hardCap);
            next = hardCap;
            overage = overage.add(excess);
        }
        spentActual = next;
        actualTokens += tokens;
        settledCalls++;

        boolean softCapCrossed = false;
        if (!softCapNotified && spentActual.compareTo(softCap) >= 0) {
            softCapNotified = true;
            softCapCrossed = true;
        }
        return new Settlement(true, excess, softCapCrossed);
    }

    /**
     * Reverses a provisional debit for a call that was not billed.
     */
    synchronized boolean release(String reservationId) {
        BigDecimal estimated = pending.remove(reservationId);
        if (estimated == null) {
            return false;
        }
        spentEstimated = spentEstimated.subtract(estimated);
        return true;
    }

    synchronized void setOverride(boolean override) {
        this.override = override;
    }

    synchronized boolean hasPending() {
        return !pending.isEmpty();
    }

    YearMonth getPeriod() {
        return period;
    }

    synchronized BudgetStatus toStatus() {
        return BudgetStatus.builder()
                .tenantId(tenantId)
                .period(period)
                .spentEstimated(spentEstimated)
                .spentActual(spentActual)
                .hardCap(hardCap)
                .softCap(softCap)
                .overage(overage)
                .actualTokens(actualTokens)
                .settledCalls(settledCalls)
                .override(override)
                .softCapReached(spentActual.compareTo(softCap) >= 0)
                .exhausted(spentActual.compareTo(hardCap) >= 0)
                .build();
    }
}
