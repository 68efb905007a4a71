package me.golemcore.aigate.adapter.inbound.web.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.aigate.domain.model.BudgetStatus;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetStatusResponse {

    private String tenantId;
    private String period;
    private BigDecimal spentEstimated;
    private BigDecimal spentActual;
    private BigDecimal hardCap;
    private BigDecimal softCap;
    private BigDecimal remaining;
    private BigDecimal overage;
    private double usagePercent;
    private long actualTokens;
    private long settledCalls;
    private boolean override;
    private boolean softCapReached;
    private boolean exhausted;

    public static BudgetStatusResponse from(BudgetStatus status) {
        return BudgetStatusResponse.builder()
                .tenantId(status.getTenantId())
                .period(status.getPeriod().toString())
                .spentEstimated(status.getSpentEstimated())
                .spentActual(status.getSpentActual())
                .hardCap(status.getHardCap())
                .softCap(status.getSoftCap())
                .remaining(status.getRemaining())
                .overage(status.getOverage())
                .usagePercent(status.getUsagePercent())
                .actualTokens(status.getActualTokens())
                .settledCalls(status.getSettledCalls())
                .override(status.isOverride())
                .softCapReached(status.isSoftCapReached())
                .exhausted(status.isExhausted())
                .build();
    }
}
