package me.golemcore.aigate.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FallbackTemplateCatalogTest {

    private FallbackTemplateCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new FallbackTemplateCatalog(new ObjectMapper());
        catalog.init();
    }

    @Test
    void shouldLoadBundledGroups() {
        assertTrue(catalog.getGroupNames().contains("assessment-help"));
        assertTrue(catalog.getGroupNames().contains("recommendations"));
        assertTrue(catalog.getServiceUnavailable().isPresent());
    }

    @Test
    void shouldPickVariantFromContext() {
        Optional<FallbackTemplateCatalog.Match> match = catalog.find("help", Map.of("frameworkId", "GDPR"));

        assertTrue(match.isPresent());
        assertEquals("assessment-help/gdpr", match.get().key());
        assertTrue(match.get().template().getText().contains("GDPR"));
        assertEquals(0.7, match.get().template().getConfidence(), 1e-9);
    }

    @Test
    void shouldNormalizeVariantNames() {
        assertEquals("assessment-help/iso27001",
                catalog.find("Assessment-Help", Map.of("frameworkId", "ISO 27001")).orElseThrow().key());
        assertEquals("recommendations/high",
                catalog.find("recommendations", Map.of("riskLevel", "high_risk")).orElseThrow().key());
    }

    @Test
    void shouldFallBackToDefaultVariant() {
        assertEquals("assessment-help/general",
                catalog.find("help", Map.of("frameworkId", "soc2")).orElseThrow().key());
        assertEquals("recommendations/medium", catalog.find("recommendations", null).orElseThrow().key());
    }

    @Test
    void shouldReturnEmptyForUnknownTaskType() {
        assertTrue(catalog.find("translation", Map.of()).isEmpty());
        assertTrue(catalog.find(null, Map.of()).isEmpty());
    }

    @Test
    void shouldNormalizeVariantValues() {
        assertNull(FallbackTemplateCatalog.normalizeVariant(" "));
        assertEquals("risk", FallbackTemplateCatalog.normalizeVariant("Risk"));
        assertEquals("low", FallbackTemplateCatalog.normalizeVariant("Low Risk"));
    }
}
