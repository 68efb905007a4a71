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

import me.golemcore.aigate.domain.model.ProviderDescriptor;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prices a call from descriptor rates (per 1000 tokens).
 *
 * <p>
 * Before the call the input size is approximated as one token per
 * {@code chars-per-token} characters and the output as the configured
 * {@code estimated-output-tokens}. After the call the real token counts
 * reported by the provider are priced the same way.
 */
@Component
public class CostEstimator {

    public static final int COST_SCALE = 6;

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final AiGateProperties properties;

    public CostEstimator(AiGateProperties properties) {
        this.properties = properties;
    }

    public int estimateInputTokens(String prompt) {
        if (prompt == null || prompt.isEmpty()) {
            return 0;
        }
        int charsPerToken = properties.getBudget().getCharsPerToken();
        return (prompt.length() + charsPerToken - 1) / charsPerToken;
    }

    public BigDecimal estimate(ProviderDescriptor descriptor, String prompt) {
        return price(descriptor, estimateInputTokens(prompt), properties.getBudget().getEstimatedOutputTokens());
    }

    public BigDecimal actualCost(ProviderDescriptor descriptor, int tokensIn, int tokensOut) {
        return price(descriptor, Math.max(0, tokensIn), Math.max(0, tokensOut));
    }

    private static BigDecimal price(ProviderDescriptor descriptor, long tokensIn, long tokensOut) {
        BigDecimal input = rate(descriptor.getCostPerThousandInput()).multiply(BigDecimal.valueOf(tokensIn));
        BigDecimal output = rate(descriptor.getCostPerThousandOutput()).multiply(BigDecimal.valueOf(tokensOut));
        return input.add(output).divide(THOUSAND, COST_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal rate(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
