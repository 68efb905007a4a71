package me.golemcore.aigate.circuit;

import me.golemcore.aigate.domain.exception.ProviderInvocationException;
import me.golemcore.aigate.domain.model.CircuitBreakerSnapshot;
import me.golemcore.aigate.domain.model.CircuitState;
import me.golemcore.aigate.domain.service.ResilienceEventService;
import me.golemcore.aigate.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CircuitBreakerRegistryTest {

    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CircuitBreakerRegistry(new CircuitBreakerConfig(1, Duration.ofSeconds(30)),
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")), mock(ResilienceEventService.class));
    }

    @Test
    void shouldReturnSameBreakerForSamePair() {
        CircuitBreaker first = registry.forProvider("openai", "gpt-4o");
        CircuitBreaker second = registry.forProvider("openai", "gpt-4o");

        assertSame(first, second);
    }

    @Test
    void shouldIsolateModelsOfSameProvider() {
        registry.forProvider("openai", "gpt-4o").execute(
                () -> CompletableFuture.failedFuture(new ProviderInvocationException("openai", "down")),
                Duration.ofSeconds(1));

        assertEquals(CircuitState.OPEN, registry.forProvider("openai", "gpt-4o").getState());
        assertEquals(CircuitState.CLOSED, registry.forProvider("openai", "gpt-4o-mini").getState());
    }

    @Test
    void shouldListSnapshotsSorted() {
        registry.forProvider("openai", "gpt-4o");
        registry.forProvider("anthropic", "claude");

        List<CircuitBreakerSnapshot> snapshots = registry.snapshots();

        assertEquals(2, snapshots.size());
        assertEquals("anthropic", snapshots.get(0).providerId());
        assertEquals("openai", snapshots.get(1).providerId());
    }

    @Test
    void shouldResetExistingBreakerOnly() {
        registry.forProvider("openai", "gpt-4o").execute(
                () -> CompletableFuture.failedFuture(new ProviderInvocationException("openai", "down")),
                Duration.ofSeconds(1));

        assertTrue(registry.reset("openai", "gpt-4o"));
        assertFalse(registry.reset("openai", "unknown"));
        assertEquals(CircuitState.CLOSED, registry.find("openai", "gpt-4o").orElseThrow().getState());
        assertTrue(registry.find("openai", "unknown").isEmpty());
    }
}
