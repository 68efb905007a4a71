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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.aigate.domain.exception.ProviderInvocationException;
import me.golemcore.aigate.domain.model.ProviderResult;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;

/**
 * Provider transport backed by LangChain4j chat models.
 *
 * <p>
 * One adapter serves one configured endpoint ({@code aigate.endpoints.<id>}):
 * <ul>
 * <li>openai - OpenAI or any OpenAI-compatible API (base URL override)</li>
 * <li>anthropic - Anthropic Messages API</li>
 * </ul>
 *
 * <p>
 * Models are built lazily per (model, timeout) and reused. Client-side retries
 * are disabled: failover and breaker accounting belong to the router.
 *
 * @see ProviderAdapterRegistry
 */
@Slf4j
public class Langchain4jProviderAdapter implements ProviderAdapter {

    static final String KIND_ANTHROPIC = "anthropic";

    private final String providerId;
    private final AiGateProperties.EndpointProperties endpoint;
    private final Executor executor;
    private final BiFunction<String, Duration, ChatModel> modelFactory;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jProviderAdapter(String providerId, AiGateProperties.EndpointProperties endpoint,
            Executor executor) {
        this.providerId = providerId;
        this.endpoint = endpoint;
        this.executor = executor;
        this.modelFactory = this::createModel;
    }

    Langchain4jProviderAdapter(String providerId, AiGateProperties.EndpointProperties endpoint, Executor executor,
            BiFunction<String, Duration, ChatModel> modelFactory) {
        this.providerId = providerId;
        this.endpoint = endpoint;
        this.executor = executor;
        this.modelFactory = modelFactory;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public boolean isAvailable() {
        return hasText(endpoint.getApiKey()) || hasText(endpoint.getBaseUrl());
    }

    @Override
    public CompletableFuture<ProviderResult> invoke(String modelId, String prompt, Duration timeout) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new ProviderInvocationException(providerId, "Provider " + providerId + " is not configured");
            }
            ChatModel model = models.computeIfAbsent(modelId + "@" + timeout.toMillis(),
                    key -> modelFactory.apply(modelId, timeout));
            List<ChatMessage> messages = List.of(UserMessage.from(prompt));

            ChatResponse response;
            try {
                response = model.chat(messages);
            } catch (RateLimitException e) {
                throw new ProviderInvocationException(providerId,
                        "Rate limited by " + providerId + ": " + e.getMessage(), e);
            } catch (RuntimeException e) {
                log.debug("[Provider] {} call to {} failed: {}", providerId, modelId, e.getMessage());
                throw new ProviderInvocationException(providerId,
                        "Call to " + providerId + "/" + modelId + " failed: " + e.getMessage(), e);
            }
            return convertResponse(modelId, response);
        }, executor);
    }

    private ProviderResult convertResponse(String modelId, ChatResponse response) {
        AiMessage aiMessage = response != null ? response.aiMessage() : null;
        if (aiMessage == null || aiMessage.text() == null) {
            throw new ProviderInvocationException(providerId, "Empty answer from " + providerId + "/" + modelId);
        }

        int tokensIn = 0;
        int tokensOut = 0;
        TokenUsage usage = response.tokenUsage();
        if (usage != null) {
            tokensIn = usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
            tokensOut = usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
        }
        return new ProviderResult(aiMessage.text(), tokensIn, tokensOut);
    }

    private ChatModel createModel(String modelName, Duration timeout) {
        if (KIND_ANTHROPIC.equalsIgnoreCase(endpoint.getKind())) {
            return createAnthropicModel(modelName, timeout);
        }
        return createOpenAiModel(modelName, timeout);
    }

    private ChatModel createAnthropicModel(String modelName, Duration timeout) {
        var builder = AnthropicChatModel.builder()
                .apiKey(endpoint.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(endpoint.getMaxOutputTokens())
                .timeout(timeout);

        if (endpoint.getBaseUrl() != null) {
            builder.baseUrl(endpoint.getBaseUrl());
        }
        if (endpoint.getTemperature() != null) {
            builder.temperature(endpoint.getTemperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, Duration timeout) {
        var builder = OpenAiChatModel.builder()
                .apiKey(endpoint.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(endpoint.getMaxOutputTokens())
                .timeout(timeout);

        if (endpoint.getBaseUrl() != null) {
            builder.baseUrl(endpoint.getBaseUrl());
        }
        if (endpoint.getTemperature() != null) {
            builder.temperature(endpoint.getTemperature());
        }
        return builder.build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
