package me.golemcore.aigate.domain.service;

import me.golemcore.aigate.domain.model.ResilienceEvent;
import me.golemcore.aigate.domain.model.ResilienceEventType;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import me.golemcore.aigate.infrastructure.event.SpringEventBus;
import me.golemcore.aigate.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ResilienceEventServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    private SpringEventBus eventBus;
    private ResilienceEventService service;

    @BeforeEach
    void setUp() {
        AiGateProperties properties = new AiGateProperties();
        properties.getEvents().setHistorySize(3);
        eventBus = mock(SpringEventBus.class);
        service = new ResilienceEventService(new MutableClock(NOW), eventBus, properties);
    }

    @Test
    void shouldTimestampAndPublishEvent() {
        ResilienceEvent event = service.emit(ResilienceEventType.BREAKER_OPENED, Map.of("provider", "openai"));

        assertEquals(NOW, event.timestamp());
        assertEquals("openai", event.attributes().get("provider"));
        verify(eventBus).publish(event);
    }

    @Test
    void shouldCopyAttributes() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("tenant", "acme");

        ResilienceEvent event = service.emit(ResilienceEventType.BUDGET_EXCEEDED, attributes);
        attributes.put("tenant", "globex");

        assertEquals("acme", event.attributes().get("tenant"));
        assertThrows(UnsupportedOperationException.class, () -> event.attributes().put("x", "y"));
    }

    @Test
    void shouldKeepBoundedHistoryNewestFirst() {
        service.emit(ResilienceEventType.CACHE_HIT, Map.of("n", 1));
        service.emit(ResilienceEventType.CACHE_HIT, Map.of("n", 2));
        service.emit(ResilienceEventType.CACHE_HIT, Map.of("n", 3));
        service.emit(ResilienceEventType.CACHE_HIT, Map.of("n", 4));

        List<ResilienceEvent> events = service.getRecentEvents(10);

        assertEquals(3, events.size());
        assertEquals(4, events.get(0).attributes().get("n"));
        assertEquals(2, events.get(2).attributes().get("n"));
        assertEquals(1, service.getRecentEvents(1).size());
    }

    @Test
    void shouldSurviveFailingListener() {
        doThrow(new IllegalStateException("listener down")).when(eventBus).publish(any());

        ResilienceEvent event = service.emit(ResilienceEventType.FALLBACK_SERVED, null);

        assertTrue(event.attributes().isEmpty());
        assertEquals(1, service.getRecentEvents(5).size());
    }
}
