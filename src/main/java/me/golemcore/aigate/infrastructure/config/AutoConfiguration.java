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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans and startup validation.
 *
 * <p>
 * Exposes the {@link Clock} every time-dependent component reads, the Jackson
 * mapper, and the bounded executor upstream provider calls run on.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AiGateProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Provider calls run here without a queue: a call either starts right away
     * or is rejected, so the breaker timeout never runs while a call waits for
     * a thread.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor() {
        int threads = properties.getCall().getExecutorThreads();
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS, new SynchronousQueue<>(), r -> {
            Thread t = new Thread(r, "provider-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }, new ThreadPoolExecutor.AbortPolicy());
    }

    @PostConstruct
    public void init() {
        properties.validate();
        log.info("AI gate starting...");
        log.info("Circuit breaker: threshold={}, recovery={}", properties.getCircuitBreaker().getFailureThreshold(),
                properties.getCircuitBreaker().getRecoveryTimeout());
        log.info("Rate limiting {} with tiers {}", properties.getRateLimit().isEnabled() ? "enabled" : "disabled",
                properties.getRateLimit().getTiers().keySet());
        log.info("Providers configured: {}", properties.getProviders().size());
        log.info("Default call timeout: {}", properties.getCall().getTimeout());
    }
}
