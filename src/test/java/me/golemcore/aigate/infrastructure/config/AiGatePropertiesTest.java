package me.golemcore.aigate.infrastructure.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AiGatePropertiesTest {

    private AiGateProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AiGateProperties();
        properties.getProviders().add(provider("openai", "gpt-4o-mini"));
    }

    @Test
    void shouldAcceptDefaults() {
        assertDoesNotThrow(properties::validate);
        assertEquals(3, properties.getCircuitBreaker().getFailureThreshold());
        assertEquals(Duration.ofSeconds(30), properties.getCircuitBreaker().getRecoveryTimeout());
        assertEquals(20, properties.getRateLimit().getTiers().get("help").getLimit());
        assertTrue(properties.getRateLimit().getTiers().get("streaming").isConcurrent());
    }

    @Test
    void shouldRejectZeroFailureThreshold() {
        properties.getCircuitBreaker().setFailureThreshold(0);

        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    void shouldRejectTaskMappedToUnknownTier() {
        properties.getRateLimit().getTaskOperationClasses().put("assessment-help", "premium");

        IllegalStateException error = assertThrows(IllegalStateException.class, properties::validate);
        assertTrue(error.getMessage().contains("premium"));
    }

    @Test
    void shouldRejectDuplicateProviderEntries() {
        properties.getProviders().add(provider("openai", "gpt-4o-mini"));

        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    void shouldRejectNegativePrices() {
        properties.getProviders().get(0).setCostPerThousandInput(new BigDecimal("-0.01"));

        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    void shouldRejectTenantReferencingUnknownProvider() {
        AiGateProperties.TenantProperties tenant = new AiGateProperties.TenantProperties();
        tenant.setProviders(List.of("mistral"));
        properties.getTenants().put("acme", tenant);

        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    void shouldRejectSoftCapPercentOutOfRange() {
        properties.getBudget().setSoftCapPercent(120);

        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    void shouldRejectNonPositiveCallTimeout() {
        properties.getCall().setTimeout(Duration.ZERO);

        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    void shouldRejectFallbackTtlOutlivingRecoveryTimeout() {
        properties.getCache().setFallbackTtl(properties.getCircuitBreaker().getRecoveryTimeout());

        IllegalStateException error = assertThrows(IllegalStateException.class, properties::validate);
        assertTrue(error.getMessage().contains("fallback-ttl"));
    }

    @Test
    void shouldAcceptFallbackTtlBelowRecoveryTimeout() {
        properties.getCircuitBreaker().setRecoveryTimeout(Duration.ofMinutes(2));
        properties.getCache().setFallbackTtl(Duration.ofSeconds(90));

        assertDoesNotThrow(properties::validate);
        assertEquals(Duration.ofSeconds(20), new AiGateProperties().getCache().getFallbackTtl());
    }

    private static AiGateProperties.ProviderProperties provider(String id, String model) {
        AiGateProperties.ProviderProperties provider = new AiGateProperties.ProviderProperties();
        provider.setId(id);
        provider.setModel(model);
        return provider;
    }
}
