package me.golemcore.aigate.budget;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DriftMonitorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String TENANT = "acme";

    private DriftMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new DriftMonitor(Duration.ofHours(1), 5.0);
    }

    @Test
    void shouldFireWhenSingleCallDriftsTwentyPercent() {
        Optional<BigDecimal> drift = monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.12"), T0);

        assertTrue(drift.isPresent());
        assertEquals(0, new BigDecimal("0.2").compareTo(drift.get()));
    }

    @Test
    void shouldStayQuietWithinThreshold() {
        assertTrue(monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.104"), T0).isEmpty());
        assertTrue(monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.096"), T0).isEmpty());
    }

    @Test
    void shouldAggregateAcrossWindow() {
        assertTrue(monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.104"), T0).isEmpty());
        assertTrue(monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.104"), T0).isEmpty());

        Optional<BigDecimal> drift = monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.13"),
                T0.plusSeconds(1));

        assertTrue(drift.isPresent());
    }

    @Test
    void shouldAlertOnceUntilBackWithinThreshold() {
        assertTrue(monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.12"), T0).isPresent());
        assertTrue(monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.12"), T0).isEmpty());

        // Window slides past the drifting samples
        Instant later = T0.plus(Duration.ofHours(2));
        assertTrue(monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.10"), later).isEmpty());

        assertTrue(monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.20"), later).isPresent());
    }

    @Test
    void shouldTrackTenantsSeparately() {
        assertTrue(monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.12"), T0).isPresent());

        assertTrue(monitor.record("globex", new BigDecimal("0.10"), new BigDecimal("0.10"), T0).isEmpty());
    }

    @Test
    void shouldIgnoreZeroEstimates() {
        assertTrue(monitor.record(TENANT, BigDecimal.ZERO, new BigDecimal("0.05"), T0).isEmpty());
    }

    @Test
    void shouldEvictIdleTenants() {
        monitor.record(TENANT, new BigDecimal("0.10"), new BigDecimal("0.10"), T0);

        assertEquals(0, monitor.evictIdle(T0.plusSeconds(60)));
        assertEquals(1, monitor.evictIdle(T0.plus(Duration.ofHours(2))));
    }
}
