package me.golemcore.aigate.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.YearMonth;

@Data
@Builder
public class BudgetStatus {

    private String tenantId;
    private YearMonth period;
    private BigDecimal spentEstimated;
    private BigDecimal spentActual;
    private BigDecimal hardCap;
    private BigDecimal softCap;
    private BigDecimal overage;
    private long actualTokens;
    private long settledCalls;
    private boolean override;
    private boolean softCapReached;
    private boolean exhausted;

    public BigDecimal getRemaining() {
        BigDecimal remaining = hardCap.subtract(spentEstimated);
        return remaining.signum() > 0 ? remaining : BigDecimal.ZERO;
    }

    public double getUsagePercent() {
        if (hardCap.signum() <= 0) {
            return 0.0;
        }
        return spentActual.doubleValue() / hardCap.doubleValue() * 100.0;
    }
}
