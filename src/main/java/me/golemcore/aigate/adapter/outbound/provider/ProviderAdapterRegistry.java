package me.golemcore.aigate.adapter.outbound.provider;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import me.golemcore.aigate.port.outbound.ProviderPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Registry of provider transports, indexed by provider id.
 *
 * <p>
 * Sources, in order of precedence:
 * <ul>
 * <li>{@link ProviderAdapter} beans from the application context</li>
 * <li>{@link Langchain4jProviderAdapter} per {@code aigate.endpoints} entry</li>
 * </ul>
 *
 * @see ProviderAdapter
 * @see Langchain4jProviderAdapter
 */
@Component
@Slf4j
public class ProviderAdapterRegistry {

    private final AiGateProperties properties;
    private final ExecutorService providerExecutor;
    private final List<ProviderAdapter> adapters;

    private final Map<String, ProviderPort> adaptersByProvider = new ConcurrentHashMap<>();

    @Autowired
    public ProviderAdapterRegistry(AiGateProperties properties,
            @Qualifier("providerExecutor") ExecutorService providerExecutor,
            ObjectProvider<ProviderAdapter> adapterBeans) {
        this(properties, providerExecutor, adapterBeans.orderedStream().toList());
    }

    ProviderAdapterRegistry(AiGateProperties properties, ExecutorService providerExecutor,
            List<ProviderAdapter> adapters) {
        this.properties = properties;
        this.providerExecutor = providerExecutor;
        this.adapters = adapters;
    }

    @PostConstruct
    public void init() {
        for (ProviderAdapter adapter : adapters) {
            adapter.initialize();
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered provider adapter: {}", adapter.getProviderId());
        }

        for (Map.Entry<String, AiGateProperties.EndpointProperties> entry : properties.getEndpoints().entrySet()) {
            String providerId = entry.getKey();
            if (adaptersByProvider.containsKey(providerId)) {
                log.info("Endpoint '{}' shadowed by adapter bean", providerId);
                continue;
            }
            adaptersByProvider.put(providerId,
                    new Langchain4jProviderAdapter(providerId, entry.getValue(), providerExecutor));
            log.debug("Registered {} endpoint: {}", entry.getValue().getKind(), providerId);
        }

        for (AiGateProperties.ProviderProperties provider : properties.getProviders()) {
            if (!isProviderAvailable(provider.getId())) {
                log.warn("Provider '{}' has no usable transport, calls to it will fail over", provider.getId());
            }
        }
    }

    /**
     * Get adapter by provider ID, or {@code null} if none is registered.
     */
    public ProviderPort getAdapter(String providerId) {
        return adaptersByProvider.get(providerId);
    }

    public Map<String, ProviderPort> getAllAdapters() {
        return Map.copyOf(adaptersByProvider);
    }

    /**
     * Check if a provider is available.
     */
    public boolean isProviderAvailable(String providerId) {
        ProviderPort adapter = adaptersByProvider.get(providerId);
        return adapter != null && adapter.isAvailable();
    }
}
