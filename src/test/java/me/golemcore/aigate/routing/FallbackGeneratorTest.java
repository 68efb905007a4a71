package me.golemcore.aigate.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.aigate.domain.model.DegradationReason;
import me.golemcore.aigate.domain.model.FallbackContent;
import me.golemcore.aigate.domain.model.FallbackStats;
import me.golemcore.aigate.domain.model.GenerationRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FallbackGeneratorTest {

    private FallbackGenerator generator;

    @BeforeEach
    void setUp() {
        FallbackTemplateCatalog catalog = new FallbackTemplateCatalog(new ObjectMapper());
        catalog.init();
        generator = new FallbackGenerator(catalog);
    }

    @Test
    void shouldServeTemplateForKnownTaskType() {
        FallbackContent content = generator.generate(request("help", Map.of("frameworkId", "gdpr")),
                DegradationReason.CIRCUITS_OPEN, null);

        assertEquals("template:assessment-help/gdpr", content.source());
        assertEquals(0.7, content.confidence(), 1e-9);
    }

    @Test
    void shouldServeServiceNoticeWhenProvidersAreDown() {
        FallbackContent content = generator.generate(request("translation", Map.of()),
                DegradationReason.PROVIDERS_FAILED, new IllegalStateException("boom"));

        assertEquals(FallbackGenerator.SOURCE_SERVICE_STATUS, content.source());
        assertEquals(0.9, content.confidence(), 1e-9);
        assertFalse(content.text().contains("boom"));
    }

    @Test
    void shouldServeBasicMessageForRateLimitOnUnknownTask() {
        FallbackContent content = generator.generate(request("translation", Map.of()),
                DegradationReason.RATE_LIMITED, null);

        assertEquals(FallbackGenerator.SOURCE_BASIC, content.source());
        assertEquals(FallbackGenerator.BASIC_CONFIDENCE, content.confidence(), 1e-9);
        assertTrue(content.text().contains("translation"));
        assertTrue(content.text().contains(DegradationReason.RATE_LIMITED.getMessage()));
    }

    @Test
    void shouldNotEchoPrompt() {
        GenerationRequest request = GenerationRequest.builder()
                .subjectId("user-1")
                .tenantId("acme")
                .taskType("translation")
                .prompt("secret customer data")
                .build();

        FallbackContent content = generator.generate(request, DegradationReason.BUDGET_EXCEEDED, null);

        assertFalse(content.text().isBlank());
        assertFalse(content.text().contains("secret customer data"));
    }

    @Test
    void shouldCountFallbacks() {
        generator.generate(request("help", Map.of()), DegradationReason.CIRCUITS_OPEN, null);
        generator.generate(request("help", Map.of()), DegradationReason.RATE_LIMITED, null);
        generator.generate(request("translation", Map.of()), DegradationReason.NO_PROVIDERS, null);

        FallbackStats stats = generator.getStats();
        assertEquals(3, stats.getTotalFallbacks());
        assertEquals(1L, stats.getByReason().get("circuits_open"));
        assertEquals(1L, stats.getByReason().get("rate_limited"));
        assertEquals(2L, stats.getByTaskType().get("help"));
        assertEquals(2L, stats.getBySource().get("template"));
        assertEquals(1L, stats.getBySource().get("service_status"));
    }

    private static GenerationRequest request(String taskType, Map<String, String> context) {
        return GenerationRequest.builder()
                .subjectId("user-1")
                .tenantId("acme")
                .taskType(taskType)
                .prompt("Explain the requirement")
                .context(context)
                .build();
    }
}
