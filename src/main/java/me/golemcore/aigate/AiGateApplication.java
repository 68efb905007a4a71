package me.golemcore.aigate;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for the AI gate.
 *
 * <p>
 * The AI gate guards every outbound call to a language-model provider with a
 * per-model circuit breaker, per-subject rate limiting, ordered provider
 * failover, a response cache with degraded fallbacks and per-tenant budget
 * enforcement.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ResilienceController
 * Domain Layer       → ProviderRouter, CircuitBreaker, RateLimiter, CostGovernor, ResponseCache
 * Infrastructure     → LangChain4j provider adapters, Spring event bus
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code aigate.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class AiGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiGateApplication.class, args);
    }

}
