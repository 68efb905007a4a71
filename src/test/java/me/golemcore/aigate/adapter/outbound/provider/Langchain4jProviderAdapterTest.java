package me.golemcore.aigate.adapter.outbound.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.aigate.domain.exception.ProviderInvocationException;
import me.golemcore.aigate.domain.model.ProviderResult;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jProviderAdapterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private AiGateProperties.EndpointProperties endpoint;
    private ChatModel chatModel;
    private AtomicInteger modelsBuilt;
    private Langchain4jProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        endpoint = new AiGateProperties.EndpointProperties();
        endpoint.setApiKey("sk-test");
        chatModel = mock(ChatModel.class);
        modelsBuilt = new AtomicInteger();
        adapter = new Langchain4jProviderAdapter("openai", endpoint, Runnable::run, (model, timeout) -> {
            modelsBuilt.incrementAndGet();
            return chatModel;
        });
    }

    @Test
    void shouldReturnTextAndTokenCounts() throws Exception {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Answer"))
                .tokenUsage(new TokenUsage(12, 34))
                .build());

        ProviderResult result = adapter.invoke("gpt-4o-mini", "Question", TIMEOUT).get();

        assertEquals("Answer", result.text());
        assertEquals(12, result.tokensIn());
        assertEquals(34, result.tokensOut());
        verify(chatModel).chat(List.of(UserMessage.from("Question")));
    }

    @Test
    void shouldTolerateMissingTokenUsage() throws Exception {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Answer"))
                .build());

        ProviderResult result = adapter.invoke("gpt-4o-mini", "Question", TIMEOUT).get();

        assertEquals(0, result.totalTokens());
    }

    @Test
    void shouldReuseModelPerNameAndTimeout() throws Exception {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Answer"))
                .build());

        adapter.invoke("gpt-4o-mini", "one", TIMEOUT).get();
        adapter.invoke("gpt-4o-mini", "two", TIMEOUT).get();
        adapter.invoke("gpt-4o", "three", TIMEOUT).get();

        assertEquals(2, modelsBuilt.get());
    }

    @Test
    void shouldWrapRateLimitAsProviderFailure() {
        when(chatModel.chat(anyList())).thenThrow(new RateLimitException("429"));

        ProviderInvocationException error = assertFailure(adapter.invoke("gpt-4o-mini", "Question", TIMEOUT));

        assertEquals("openai", error.getProviderId());
        assertInstanceOf(RateLimitException.class, error.getCause());
    }

    @Test
    void shouldWrapTransportErrors() {
        when(chatModel.chat(anyList())).thenThrow(new IllegalStateException("connection reset"));

        ProviderInvocationException error = assertFailure(adapter.invoke("gpt-4o-mini", "Question", TIMEOUT));

        assertTrue(error.getMessage().contains("connection reset"));
    }

    @Test
    void shouldRejectEmptyAnswer() {
        when(chatModel.chat(anyList())).thenReturn(null);

        assertFailure(adapter.invoke("gpt-4o-mini", "Question", TIMEOUT));
    }

    @Test
    void shouldFailWhenNotConfigured() {
        endpoint.setApiKey(" ");

        assertFalse(adapter.isAvailable());
        assertFailure(adapter.invoke("gpt-4o-mini", "Question", TIMEOUT));
        assertEquals(0, modelsBuilt.get());
    }

    @Test
    void shouldBeAvailableWithBaseUrlOnly() {
        endpoint.setApiKey(null);
        endpoint.setBaseUrl("http://localhost:11434/v1");

        assertTrue(adapter.isAvailable());
    }

    private static ProviderInvocationException assertFailure(CompletableFuture<ProviderResult> future) {
        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        return assertInstanceOf(ProviderInvocationException.class, error.getCause());
    }
}
