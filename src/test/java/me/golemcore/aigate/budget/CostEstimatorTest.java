package me.golemcore.aigate.budget;

import me.golemcore.aigate.domain.model.ProviderDescriptor;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class CostEstimatorTest {

    private static final ProviderDescriptor DESCRIPTOR = ProviderDescriptor.builder()
            .providerId("openai")
            .modelId("gpt-4o")
            .priorityRank(1)
            .costPerThousandInput(new BigDecimal("0.50"))
            .costPerThousandOutput(new BigDecimal("1.50"))
            .qualityTier("premium")
            .build();

    private CostEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new CostEstimator(new AiGateProperties());
    }

    @Test
    void shouldRoundInputTokensUp() {
        assertEquals(0, estimator.estimateInputTokens(""));
        assertEquals(1, estimator.estimateInputTokens("abc"));
        assertEquals(3, estimator.estimateInputTokens("0123456789"));
    }

    @Test
    void shouldEstimateWithConfiguredOutputTokens() {
        BigDecimal estimate = estimator.estimate(DESCRIPTOR, "0123456789");

        assertEquals(new BigDecimal("0.751500"), estimate);
    }

    @Test
    void shouldPriceActualUsage() {
        BigDecimal cost = estimator.actualCost(DESCRIPTOR, 1000, 2000);

        assertEquals(new BigDecimal("3.500000"), cost);
    }

    @Test
    void shouldTreatMissingPricesAsFree() {
        ProviderDescriptor free = ProviderDescriptor.builder().providerId("local").modelId("llama").build();

        assertEquals(0, BigDecimal.ZERO.compareTo(estimator.actualCost(free, 500, 500)));
    }
}
