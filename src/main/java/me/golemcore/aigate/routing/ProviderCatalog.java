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

import me.golemcore.aigate.domain.model.ProviderDescriptor;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Ordered provider descriptors per tenant.
 *
 * <p>
 * A tenant configured under {@code aigate.tenants.<id>.providers} sees only
 * those provider ids; any other tenant sees every configured provider. The
 * result is always sorted by {@link ProviderDescriptor#PRIORITY_ORDER}.
 */
@Component
public class ProviderCatalog {

    private final AiGateProperties properties;

    public ProviderCatalog(AiGateProperties properties) {
        this.properties = properties;
    }

    public List<ProviderDescriptor> getAll() {
        return properties.getProviders().stream()
                .map(ProviderCatalog::toDescriptor)
                .sorted(ProviderDescriptor.PRIORITY_ORDER)
                .toList();
    }

    /**
     * @param preferred
     *            provider ids or {@code provider/model} keys restricting the
     *            list; empty means no restriction
     */
    public List<ProviderDescriptor> providersFor(String tenantId, List<String> preferred) {
        AiGateProperties.TenantProperties tenant = properties.getTenants().get(tenantId);
        Set<String> allowed = tenant != null && !tenant.getProviders().isEmpty()
                ? Set.copyOf(tenant.getProviders())
                : null;
        Set<String> wanted = preferred != null && !preferred.isEmpty() ? Set.copyOf(preferred) : null;

        return getAll().stream()
                .filter(d -> allowed == null || allowed.contains(d.getProviderId()))
                .filter(d -> wanted == null || wanted.contains(d.getProviderId()) || wanted.contains(d.getKey()))
                .toList();
    }

    private static ProviderDescriptor toDescriptor(AiGateProperties.ProviderProperties provider) {
        return ProviderDescriptor.builder()
                .providerId(provider.getId())
                .modelId(provider.getModel())
                .priorityRank(provider.getPriority())
                .costPerThousandInput(provider.getCostPerThousandInput())
                .costPerThousandOutput(provider.getCostPerThousandOutput())
                .qualityTier(provider.getQualityTier())
                .build();
    }
}
