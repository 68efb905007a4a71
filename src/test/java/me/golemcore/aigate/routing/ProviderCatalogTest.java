package me.golemcore.aigate.routing;

import me.golemcore.aigate.domain.model.ProviderDescriptor;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProviderCatalogTest {

    private AiGateProperties properties;
    private ProviderCatalog catalog;

    @BeforeEach
    void setUp() {
        properties = new AiGateProperties();
        properties.getProviders().add(provider("anthropic", "claude-3-5-haiku-latest", 2));
        properties.getProviders().add(provider("openai", "gpt-4o", 3));
        properties.getProviders().add(provider("openai", "gpt-4o-mini", 1));
        catalog = new ProviderCatalog(properties);
    }

    @Test
    void shouldSortByPriorityRank() {
        List<String> keys = catalog.getAll().stream().map(ProviderDescriptor::getKey).toList();

        assertEquals(List.of("openai/gpt-4o-mini", "anthropic/claude-3-5-haiku-latest", "openai/gpt-4o"), keys);
    }

    @Test
    void shouldBreakPriorityTiesByProviderAndModel() {
        properties.getProviders().add(provider("mistral", "small", 1));

        List<String> keys = catalog.getAll().stream().map(ProviderDescriptor::getKey).toList();

        assertEquals("mistral/small", keys.get(0));
        assertEquals("openai/gpt-4o-mini", keys.get(1));
    }

    @Test
    void shouldRestrictToTenantProviders() {
        AiGateProperties.TenantProperties tenant = new AiGateProperties.TenantProperties();
        tenant.setProviders(List.of("anthropic"));
        properties.getTenants().put("acme", tenant);

        List<ProviderDescriptor> providers = catalog.providersFor("acme", List.of());

        assertEquals(1, providers.size());
        assertEquals("anthropic", providers.get(0).getProviderId());
    }

    @Test
    void shouldReturnEveryProviderForUnknownTenant() {
        assertEquals(3, catalog.providersFor("globex", null).size());
    }

    @Test
    void shouldFilterByPreferredIdsAndKeysKeepingRankOrder() {
        List<String> keys = catalog.providersFor("globex", List.of("openai/gpt-4o", "anthropic")).stream()
                .map(ProviderDescriptor::getKey)
                .toList();

        assertEquals(List.of("anthropic/claude-3-5-haiku-latest", "openai/gpt-4o"), keys);
    }

    @Test
    void shouldCarryPrices() {
        ProviderDescriptor first = catalog.getAll().get(0);

        assertEquals(0, new BigDecimal("0.15").compareTo(first.getCostPerThousandInput()));
        assertEquals(0, new BigDecimal("0.60").compareTo(first.getCostPerThousandOutput()));
    }

    private static AiGateProperties.ProviderProperties provider(String id, String model, int priority) {
        AiGateProperties.ProviderProperties provider = new AiGateProperties.ProviderProperties();
        provider.setId(id);
        provider.setModel(model);
        provider.setPriority(priority);
        provider.setCostPerThousandInput(new BigDecimal("0.15"));
        provider.setCostPerThousandOutput(new BigDecimal("0.60"));
        return provider;
    }
}
