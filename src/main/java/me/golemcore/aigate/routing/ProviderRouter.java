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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.aigate.adapter.outbound.provider.ProviderAdapterRegistry;
import me.golemcore.aigate.budget.CostEstimator;
import me.golemcore.aigate.budget.CostGovernor;
import me.golemcore.aigate.cache.RequestFingerprinter;
import me.golemcore.aigate.cache.ResponseCache;
import me.golemcore.aigate.circuit.CircuitBreaker;
import me.golemcore.aigate.circuit.CircuitBreakerRegistry;
import me.golemcore.aigate.domain.exception.AllProvidersExhaustedException;
import me.golemcore.aigate.domain.exception.CircuitOpenException;
import me.golemcore.aigate.domain.exception.ProviderException;
import me.golemcore.aigate.domain.model.BudgetDecision;
import me.golemcore.aigate.domain.model.CacheEntry;
import me.golemcore.aigate.domain.model.DegradationReason;
import me.golemcore.aigate.domain.model.FallbackContent;
import me.golemcore.aigate.domain.model.GenerationRequest;
import me.golemcore.aigate.domain.model.GenerationResponse;
import me.golemcore.aigate.domain.model.ProviderDescriptor;
import me.golemcore.aigate.domain.model.ProviderResult;
import me.golemcore.aigate.domain.model.RateLimitResult;
import me.golemcore.aigate.domain.model.ResilienceEventType;
import me.golemcore.aigate.domain.model.ResponseSource;
import me.golemcore.aigate.domain.service.ResilienceEventService;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import me.golemcore.aigate.port.outbound.ProviderPort;
import me.golemcore.aigate.ratelimit.RateLimiter;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single entry point for AI generation calls.
 *
 * <p>
 * Pipeline of one request:
 * <ol>
 * <li>response cache lookup by fingerprint</li>
 * <li>rate-limit admission for the subject and operation class</li>
 * <li>for each provider of the tenant, strictly in priority order: budget
 * authorization, then the provider call through its circuit breaker</li>
 * <li>fallback answer when every provider refused or failed</li>
 * </ol>
 *
 * <p>
 * Provider-side failures never escape: the caller always receives a
 * {@link GenerationResponse} tagged with its source and, when degraded, the
 * reason. Only malformed requests ({@link IllegalArgumentException}) and
 * unexpected programming errors propagate.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderRouter {

    private static final String LOG_PREFIX = "[Router]";

    private final AiGateProperties properties;
    private final RequestFingerprinter fingerprinter;
    private final ResponseCache cache;
    private final RateLimiter rateLimiter;
    private final ProviderCatalog catalog;
    private final CircuitBreakerRegistry breakers;
    private final CostGovernor governor;
    private final CostEstimator estimator;
    private final ProviderAdapterRegistry adapters;
    private final FallbackGenerator fallbackGenerator;
    private final ResilienceEventService eventService;

    /**
     * Blocking variant of {@link #generateAsync(GenerationRequest)}.
     */
    public GenerationResponse generate(GenerationRequest request) {
        try {
            return generateAsync(request).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    /**
     * Cancelling the returned future cancels the in-flight provider call; the
     * breaker and the governor still record its outcome.
     */
    public CompletableFuture<GenerationResponse> generateAsync(GenerationRequest request) {
        validate(request);
        String fingerprint = fingerprinter.fingerprint(request.getPrompt(), request.getTaskType(),
                request.getContext());

        Optional<CacheEntry> cached = cache.get(fingerprint);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(fromCache(request, cached.get()));
        }

        String operationClass = resolveOperationClass(request);
        RateLimitResult admission = rateLimiter.checkAndIncrement(request.getSubjectId(), operationClass);
        if (!admission.isAllowed()) {
            log.warn("{} Rate limited: subject={}, tenant={}, task={}, operationClass={}, retryAfter={}",
                    LOG_PREFIX, request.getSubjectId(), request.getTenantId(), request.getTaskType(),
                    operationClass, admission.getWaitTime());
            return CompletableFuture.completedFuture(
                    fallback(request, fingerprint, DegradationReason.RATE_LIMITED, null, false));
        }

        Attempts attempts = new Attempts(request, fingerprint,
                catalog.providersFor(request.getTenantId(), request.getPreferredProviders()),
                request.getTimeout() != null ? request.getTimeout() : properties.getCall().getTimeout());

        CompletableFuture<GenerationResponse> result;
        try {
            result = tryProvider(attempts, 0);
        } catch (RuntimeException e) {
            admission.release();
            throw e;
        }
        result.whenComplete((response, error) -> {
            admission.release();
            if (error instanceof CancellationException) {
                attempts.cancel();
            }
        });
        return result;
    }

    String resolveOperationClass(GenerationRequest request) {
        if (request.getOperationClass() != null && !request.getOperationClass().isBlank()) {
            return request.getOperationClass();
        }
        String mapped = properties.getRateLimit().getTaskOperationClasses().get(request.getTaskType());
        return mapped != null ? mapped : request.getTaskType();
    }

    private CompletableFuture<GenerationResponse> tryProvider(Attempts attempts, int index) {
        if (attempts.cancelled) {
            return CompletableFuture.failedFuture(new CancellationException("Generation cancelled"));
        }
        if (index >= attempts.descriptors.size()) {
            return CompletableFuture.completedFuture(exhausted(attempts));
        }

        GenerationRequest request = attempts.request;
        ProviderDescriptor descriptor = attempts.descriptors.get(index);
        ProviderPort port = adapters.getAdapter(descriptor.getProviderId());
        if (port == null) {
            attempts.failed++;
            attempts.trail.add(descriptor.getKey() + ": no transport");
            providerFailed(request, descriptor, "no transport configured");
            return tryProvider(attempts, index + 1);
        }

        BigDecimal estimate = estimator.estimate(descriptor, request.getPrompt());
        BudgetDecision decision = governor.authorize(request.getTenantId(), estimate);
        if (!decision.allowed()) {
            attempts.budgetDenied++;
            attempts.trail.add(descriptor.getKey() + ": " + decision.reason());
            log.debug("{} Skipping {} for tenant {}: {}", LOG_PREFIX, descriptor.getKey(), request.getTenantId(),
                    decision.reason());
            return tryProvider(attempts, index + 1);
        }

        CircuitBreaker breaker = breakers.forDescriptor(descriptor);
        CompletableFuture<ProviderResult> call = breaker.execute(
                () -> port.invoke(descriptor.getModelId(), request.getPrompt(), attempts.timeout),
                attempts.timeout);
        attempts.inFlight = call;
        if (attempts.cancelled) {
            call.cancel(true);
        }

        return call.handle((providerResult, error) -> {
            if (error == null) {
                BigDecimal cost = estimator.actualCost(descriptor, providerResult.tokensIn(),
                        providerResult.tokensOut());
                governor.recordActual(decision.reservation(), cost, providerResult.totalTokens());
                return CompletableFuture.completedFuture(success(attempts, descriptor, providerResult, cost));
            }

            governor.recordFailure(decision.reservation());
            Throwable failure = unwrap(error);
            if (failure instanceof CircuitOpenException) {
                attempts.circuitOpen++;
                attempts.trail.add(descriptor.getKey() + ": circuit open");
                log.debug("{} {} circuit open, trying next provider", LOG_PREFIX, descriptor.getKey());
            } else if (failure instanceof RejectedExecutionException) {
                attempts.failed++;
                attempts.trail.add(descriptor.getKey() + ": call pool saturated");
                log.warn("{} No free provider call thread for {}, trying next provider", LOG_PREFIX,
                        descriptor.getKey());
            } else if (failure instanceof ProviderException || failure instanceof CancellationException) {
                attempts.failed++;
                attempts.trail.add(descriptor.getKey() + ": " + failure.getClass().getSimpleName());
                providerFailed(request, descriptor, failure.getClass().getSimpleName());
            } else {
                return CompletableFuture.<GenerationResponse>failedFuture(failure);
            }
            return tryProvider(attempts, index + 1);
        }).thenCompose(next -> next);
    }

    private GenerationResponse success(Attempts attempts, ProviderDescriptor descriptor, ProviderResult result,
            BigDecimal cost) {
        GenerationResponse response = GenerationResponse.builder()
                .text(result.text())
                .source(ResponseSource.PROVIDER)
                .degraded(false)
                .providerUsed(descriptor.getProviderId())
                .modelUsed(descriptor.getModelId())
                .tokensUsed(result.totalTokens())
                .cost(cost)
                .confidence(1.0)
                .fingerprint(attempts.fingerprint)
                .build();
        cache.put(attempts.fingerprint, response, properties.getCache().getSuccessTtl());
        log.debug("{} Served by {} ({} tokens, cost {})", LOG_PREFIX, descriptor.getKey(), result.totalTokens(),
                cost);
        return response;
    }

    private GenerationResponse exhausted(Attempts attempts) {
        DegradationReason reason;
        if (attempts.descriptors.isEmpty()) {
            reason = DegradationReason.NO_PROVIDERS;
        } else if (attempts.failed == 0 && attempts.circuitOpen == 0) {
            reason = DegradationReason.BUDGET_EXCEEDED;
        } else if (attempts.failed == 0 && attempts.budgetDenied == 0) {
            reason = DegradationReason.CIRCUITS_OPEN;
        } else {
            reason = DegradationReason.PROVIDERS_FAILED;
        }
        AllProvidersExhaustedException cause = new AllProvidersExhaustedException(
                Collections.unmodifiableList(attempts.trail));
        log.warn("{} All providers exhausted: subject={}, tenant={}, task={}, reason={}, attempts={}", LOG_PREFIX,
                attempts.request.getSubjectId(), attempts.request.getTenantId(), attempts.request.getTaskType(),
                reason.getCode(), attempts.trail);
        return fallback(attempts.request, attempts.fingerprint, reason, cause,
                reason != DegradationReason.BUDGET_EXCEEDED);
    }

    private GenerationResponse fallback(GenerationRequest request, String fingerprint, DegradationReason reason,
            Throwable cause, boolean cacheable) {
        FallbackContent content = fallbackGenerator.generate(request, reason, cause);
        GenerationResponse response = GenerationResponse.builder()
                .text(content.text())
                .source(ResponseSource.FALLBACK)
                .degraded(true)
                .reason(reason)
                .confidence(content.confidence())
                .fingerprint(fingerprint)
                .build();

        if (cacheable) {
            cache.put(fingerprint, response, properties.getCache().getFallbackTtl());
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("reason", reason.getCode());
        attributes.put("subject", request.getSubjectId());
        attributes.put("tenant", request.getTenantId());
        attributes.put("taskType", request.getTaskType());
        attributes.put("fallbackSource", content.source());
        eventService.emit(ResilienceEventType.FALLBACK_SERVED, attributes);
        return response;
    }

    private GenerationResponse fromCache(GenerationRequest request, CacheEntry entry) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("fingerprintPrefix", RequestFingerprinter.prefix(entry.getFingerprint()));
        attributes.put("taskType", request.getTaskType());
        attributes.put("fallback", entry.isFallback());
        eventService.emit(ResilienceEventType.CACHE_HIT, attributes);

        if (entry.isFallback()) {
            log.warn("{} Serving cached fallback: subject={}, tenant={}, task={}, reason={}", LOG_PREFIX,
                    request.getSubjectId(), request.getTenantId(), request.getTaskType(),
                    entry.getReason().getCode());
        }
        return GenerationResponse.builder()
                .text(entry.getPayload())
                .source(ResponseSource.CACHE)
                .degraded(entry.isFallback())
                .reason(entry.getReason())
                .providerUsed(entry.getProviderUsed())
                .modelUsed(entry.getModelUsed())
                .tokensUsed(0)
                .cost(BigDecimal.ZERO)
                .confidence(entry.getConfidence())
                .fingerprint(entry.getFingerprint())
                .build();
    }

    private void providerFailed(GenerationRequest request, ProviderDescriptor descriptor, String error) {
        log.warn("{} Provider {} failed: subject={}, tenant={}, task={}, error={}", LOG_PREFIX, descriptor.getKey(),
                request.getSubjectId(), request.getTenantId(), request.getTaskType(), error);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("provider", descriptor.getProviderId());
        attributes.put("model", descriptor.getModelId());
        attributes.put("tenant", request.getTenantId());
        attributes.put("error", error);
        eventService.emit(ResilienceEventType.PROVIDER_FAILED, attributes);
    }

    private static void validate(GenerationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        requireText(request.getSubjectId(), "subjectId");
        requireText(request.getTenantId(), "tenantId");
        requireText(request.getTaskType(), "taskType");
        requireText(request.getPrompt(), "prompt");
        if (request.getTimeout() != null && (request.getTimeout().isZero() || request.getTimeout().isNegative())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Mutable progress of one request through its provider list. Touched by
     * one callback at a time, since each attempt starts after the previous one
     * completed.
     */
    private static final class Attempts {

        private final GenerationRequest request;
        private final String fingerprint;
        private final List<ProviderDescriptor> descriptors;
        private final Duration timeout;
        private final List<String> trail = new ArrayList<>();

        private int budgetDenied;
        private int circuitOpen;
        private int failed;
        private volatile boolean cancelled;
        private volatile CompletableFuture<?> inFlight;

        private Attempts(GenerationRequest request, String fingerprint, List<ProviderDescriptor> descriptors,
                Duration timeout) {
            this.request = request;
            this.fingerprint = fingerprint;
            this.descriptors = descriptors;
            this.timeout = timeout;
        }

        private void cancel() {
            cancelled = true;
            CompletableFuture<?> current = inFlight;
            if (current != null) {
                current.cancel(true);
            }
        }
    }
}
