package me.golemcore.aigate.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class AutoConfigurationTest {

    @Test
    void shouldValidatePropertiesOnInit() {
        AiGateProperties properties = new AiGateProperties();
        properties.getCache().setMaxEntries(0);

        AutoConfiguration autoConfiguration = new AutoConfiguration(properties);

        assertThrows(IllegalStateException.class, autoConfiguration::init);
    }

    @Test
    void shouldInitWithDefaults() {
        assertDoesNotThrow(() -> new AutoConfiguration(new AiGateProperties()).init());
    }

    @Test
    void shouldSerializeInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        String json = mapper.writeValueAsString(Instant.parse("2026-03-15T10:00:00Z"));

        assertEquals("\"2026-03-15T10:00:00Z\"", json);
    }

    @Test
    void shouldCreateProviderExecutor() {
        AiGateProperties properties = new AiGateProperties();
        properties.getCall().setExecutorThreads(2);

        ExecutorService executor = new AutoConfiguration(properties).providerExecutor();
        try {
            assertFalse(executor.isShutdown());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldRejectProviderCallWhenAllThreadsBusy() {
        AiGateProperties properties = new AiGateProperties();
        properties.getCall().setExecutorThreads(1);
        ExecutorService executor = new AutoConfiguration(properties).providerExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> {
            }));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }
}
