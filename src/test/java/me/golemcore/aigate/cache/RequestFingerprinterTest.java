package me.golemcore.aigate.cache;

import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequestFingerprinterTest {

    private RequestFingerprinter fingerprinter;

    @BeforeEach
    void setUp() {
        fingerprinter = new RequestFingerprinter(new AiGateProperties());
    }

    @Test
    void shouldProduceSha256Hex() {
        String fingerprint = fingerprinter.fingerprint("What is GDPR?", "help", Map.of());

        assertEquals(64, fingerprint.length());
        assertTrue(fingerprint.matches("[0-9a-f]+"));
    }

    @Test
    void shouldIgnoreWhitespaceAndTaskTypeCase() {
        String first = fingerprinter.fingerprint("  What is\n\tGDPR?  ", "Help", Map.of());
        String second = fingerprinter.fingerprint("What is GDPR?", "help", Map.of());

        assertEquals(first, second);
    }

    @Test
    void shouldNormalizeUnicodeComposition() {
        String composed = fingerprinter.fingerprint("caf\u00e9", "help", Map.of());
        String decomposed = fingerprinter.fingerprint("cafe\u0301", "help", Map.of());

        assertEquals(composed, decomposed);
    }

    @Test
    void shouldIgnoreIrrelevantContext() {
        String first = fingerprinter.fingerprint("prompt", "help",
                Map.of("frameworkId", "gdpr", "requestId", "r-1", "timestamp", "2026-03-01T10:00:00Z"));
        String second = fingerprinter.fingerprint("prompt", "help",
                Map.of("frameworkId", "gdpr", "requestId", "r-2"));

        assertEquals(first, second);
    }

    @Test
    void shouldDistinguishRelevantContext() {
        String gdpr = fingerprinter.fingerprint("prompt", "help", Map.of("frameworkId", "gdpr"));
        String iso = fingerprinter.fingerprint("prompt", "help", Map.of("frameworkId", "iso27001"));
        String otherProfile = fingerprinter.fingerprint("prompt", "help",
                Map.of("frameworkId", "gdpr", "businessProfileId", "bp-7"));

        assertNotEquals(gdpr, iso);
        assertNotEquals(gdpr, otherProfile);
    }

    @Test
    void shouldNotLetContextValueImitateAnotherKey() {
        String merged = fingerprinter.fingerprint("prompt", "help",
                Map.of("businessProfileId", "a\u001FframeworkId=b"));
        String separate = fingerprinter.fingerprint("prompt", "help",
                Map.of("businessProfileId", "a", "frameworkId", "b"));

        assertNotEquals(merged, separate);
    }

    @Test
    void shouldNotLetPromptImitateTaskType() {
        assertNotEquals(fingerprinter.fingerprint("prompt\u001Fhelp", "", null),
                fingerprinter.fingerprint("prompt", "help", null));
    }

    @Test
    void shouldDistinguishTaskTypes() {
        assertNotEquals(fingerprinter.fingerprint("prompt", "help", null),
                fingerprinter.fingerprint("prompt", "analysis", null));
    }

    @Test
    void shouldShortenToPrefix() {
        String fingerprint = fingerprinter.fingerprint("prompt", "help", Map.of());

        assertEquals(fingerprint.substring(0, 12), RequestFingerprinter.prefix(fingerprint));
        assertNull(RequestFingerprinter.prefix(null));
    }
}
