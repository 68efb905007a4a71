package me.golemcore.aigate;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class AiGateApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(AiGateApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(AiGateApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
        assertNotNull(AiGateApplication.class.getAnnotation(EnableAsync.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(AiGateApplication.class.getMethod("main", String[].class));
    }
}
