package me.golemcore.aigate.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Centralized configuration of the resilience core, bound from
 * application.yml.
 *
 * <p>
 * All options live under the {@code aigate.*} prefix:
 * <ul>
 * <li>{@link CircuitBreakerProperties} - failure threshold and recovery
 * timeout</li>
 * <li>{@link RateLimitProperties} - tiers per operation class</li>
 * <li>{@link CacheProperties} - success and fallback TTLs</li>
 * <li>{@link ProviderProperties} - ordered provider/model descriptors</li>
 * <li>{@link EndpointProperties} - transport credentials per provider</li>
 * <li>{@link TenantProperties} - provider list and caps per tenant</li>
 * <li>{@link BudgetProperties} - default caps and drift alerting</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "aigate")
@Data
public class AiGateProperties {

    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private CacheProperties cache = new CacheProperties();
    private CallProperties call = new CallProperties();
    private BudgetProperties budget = new BudgetProperties();
    private EventsProperties events = new EventsProperties();
    private MaintenanceProperties maintenance = new MaintenanceProperties();
    private List<ProviderProperties> providers = new ArrayList<>();
    private Map<String, EndpointProperties> endpoints = new HashMap<>();
    private Map<String, TenantProperties> tenants = new HashMap<>();

    @Data
    public static class CircuitBreakerProperties {
        private int failureThreshold = 3;
        private Duration recoveryTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private Map<String, TierProperties> tiers = defaultTiers();
        private Map<String, String> taskOperationClasses = new HashMap<>();
    }

    @Data
    public static class TierProperties {
        private int limit;
        private Duration window = Duration.ofMinutes(1);
        // When positive the tier counts in-flight calls instead of a window
        private int maxConcurrent;

        public boolean isConcurrent() {
            return maxConcurrent > 0;
        }

        static TierProperties windowed(int limit) {
            TierProperties tier = new TierProperties();
            tier.setLimit(limit);
            return tier;
        }

        static TierProperties concurrent(int maxConcurrent) {
            TierProperties tier = new TierProperties();
            tier.setMaxConcurrent(maxConcurrent);
            return tier;
        }
    }

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private Duration successTtl = Duration.ofHours(1);
        // Zero disables caching of fallback answers; must stay below the
        // breaker recovery timeout
        private Duration fallbackTtl = Duration.ofSeconds(20);
        private int maxEntries = 1000;
        private List<String> contextKeys = new ArrayList<>(List.of("businessProfileId", "frameworkId"));
    }

    @Data
    public static class CallProperties {
        private Duration timeout = Duration.ofSeconds(30);
        private int executorThreads = 16;
    }

    @Data
    public static class BudgetProperties {
        private BigDecimal defaultHardCap = new BigDecimal("100.00");
        private int softCapPercent = 80;
        private double driftThresholdPercent = 5.0;
        private Duration driftWindow = Duration.ofHours(1);
        private int estimatedOutputTokens = 500;
        private int charsPerToken = 4;
        private String zone = "UTC";
    }

    @Data
    public static class EventsProperties {
        private int historySize = 200;
    }

    @Data
    public static class MaintenanceProperties {
        private Duration interval = Duration.ofMinutes(1);
    }

    @Data
    public static class ProviderProperties {
        private String id;
        private String model;
        private int priority;
        private BigDecimal costPerThousandInput = BigDecimal.ZERO;
        private BigDecimal costPerThousandOutput = BigDecimal.ZERO;
        private String qualityTier = "standard";
    }

    @Data
    public static class EndpointProperties {
        // openai (any OpenAI-compatible API) or anthropic
        private String kind = "openai";
        private String apiKey;
        private String baseUrl;
        private int maxOutputTokens = 4096;
        private Double temperature;
    }

    @Data
    public static class TenantProperties {
        private List<String> providers = new ArrayList<>();
        private BigDecimal hardCap;
        private Integer softCapPercent;
    }

    /**
     * Rejects configurations the core cannot honor. Called once at startup.
     */
    public void validate() {
        if (circuitBreaker.getFailureThreshold() < 1) {
            throw new IllegalStateException("aigate.circuit-breaker.failure-threshold must be at least 1");
        }
        requirePositive(circuitBreaker.getRecoveryTimeout(), "aigate.circuit-breaker.recovery-timeout");
        requirePositive(call.getTimeout(), "aigate.call.timeout");
        if (call.getExecutorThreads() < 1) {
            throw new IllegalStateException("aigate.call.executor-threads must be at least 1");
        }

        for (Map.Entry<String, TierProperties> entry : rateLimit.getTiers().entrySet()) {
            TierProperties tier = entry.getValue();
            String prefix = "aigate.rate-limit.tiers." + entry.getKey();
            if (!tier.isConcurrent()) {
                if (tier.getLimit() < 1) {
                    throw new IllegalStateException(prefix + ".limit must be at least 1");
                }
                requirePositive(tier.getWindow(), prefix + ".window");
            }
        }
        for (Map.Entry<String, String> mapping : rateLimit.getTaskOperationClasses().entrySet()) {
            if (!rateLimit.getTiers().containsKey(mapping.getValue())) {
                throw new IllegalStateException("Task type '" + mapping.getKey()
                        + "' maps to unknown operation class '" + mapping.getValue() + "'");
            }
        }

        if (cache.getSuccessTtl().isNegative() || cache.getFallbackTtl().isNegative()) {
            throw new IllegalStateException("aigate.cache TTLs must not be negative");
        }
        if (cache.getFallbackTtl().compareTo(circuitBreaker.getRecoveryTimeout()) >= 0) {
            throw new IllegalStateException("aigate.cache.fallback-ttl (" + cache.getFallbackTtl()
                    + ") must be shorter than aigate.circuit-breaker.recovery-timeout ("
                    + circuitBreaker.getRecoveryTimeout() + ")");
        }
        if (cache.getMaxEntries() < 1) {
            throw new IllegalStateException("aigate.cache.max-entries must be at least 1");
        }

        Set<String> providerIds = new HashSet<>();
        Set<String> providerKeys = new HashSet<>();
        for (ProviderProperties provider : providers) {
            if (isBlank(provider.getId()) || isBlank(provider.getModel())) {
                throw new IllegalStateException("aigate.providers entries need both id and model");
            }
            if (!providerKeys.add(provider.getId() + "/" + provider.getModel())) {
                throw new IllegalStateException("Duplicate provider entry: " + provider.getId() + "/"
                        + provider.getModel());
            }
            if (provider.getCostPerThousandInput().signum() < 0 || provider.getCostPerThousandOutput().signum() < 0) {
                throw new IllegalStateException("Provider prices must not be negative: " + provider.getId());
            }
            providerIds.add(provider.getId());
        }

        validatePercent(budget.getSoftCapPercent(), "aigate.budget.soft-cap-percent");
        if (budget.getDefaultHardCap() == null || budget.getDefaultHardCap().signum() < 0) {
            throw new IllegalStateException("aigate.budget.default-hard-cap must not be negative");
        }
        if (budget.getDriftThresholdPercent() <= 0) {
            throw new IllegalStateException("aigate.budget.drift-threshold-percent must be positive");
        }
        if (budget.getCharsPerToken() < 1) {
            throw new IllegalStateException("aigate.budget.chars-per-token must be at least 1");
        }
        requirePositive(budget.getDriftWindow(), "aigate.budget.drift-window");

        for (Map.Entry<String, TenantProperties> entry : tenants.entrySet()) {
            TenantProperties tenant = entry.getValue();
            for (String providerId : tenant.getProviders()) {
                if (!providerIds.contains(providerId)) {
                    throw new IllegalStateException("Tenant '" + entry.getKey() + "' references unknown provider '"
                            + providerId + "'");
                }
            }
            if (tenant.getHardCap() != null && tenant.getHardCap().signum() < 0) {
                throw new IllegalStateException("Hard cap of tenant '" + entry.getKey() + "' must not be negative");
            }
            if (tenant.getSoftCapPercent() != null) {
                validatePercent(tenant.getSoftCapPercent(), "soft-cap-percent of tenant " + entry.getKey());
            }
        }
    }

    private static Map<String, TierProperties> defaultTiers() {
        Map<String, TierProperties> tiers = new LinkedHashMap<>();
        tiers.put("help", TierProperties.windowed(20));
        tiers.put("analysis", TierProperties.windowed(5));
        tiers.put("recommendations", TierProperties.windowed(10));
        tiers.put("quick-check", TierProperties.windowed(30));
        tiers.put("streaming", TierProperties.concurrent(3));
        return tiers;
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalStateException(name + " must be a positive duration");
        }
    }

    private static void validatePercent(int percent, String name) {
        if (percent < 1 || percent > 100) {
            throw new IllegalStateException(name + " must be between 1 and 100");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
