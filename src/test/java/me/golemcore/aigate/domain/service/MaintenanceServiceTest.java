package me.golemcore.aigate.domain.service;

import me.golemcore.aigate.budget.CostGovernor;
import me.golemcore.aigate.cache.ResponseCache;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import me.golemcore.aigate.ratelimit.FixedWindowRateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MaintenanceServiceTest {

    private FixedWindowRateLimiter rateLimiter;
    private ResponseCache cache;
    private CostGovernor governor;
    private MaintenanceService service;

    @BeforeEach
    void setUp() {
        rateLimiter = mock(FixedWindowRateLimiter.class);
        cache = mock(ResponseCache.class);
        governor = mock(CostGovernor.class);
        service = new MaintenanceService(new AiGateProperties(), rateLimiter, cache, governor);
    }

    @Test
    void shouldEvictEveryKindOfIdleState() {
        when(rateLimiter.evictIdle()).thenReturn(2);
        when(cache.evictExpired()).thenReturn(5);

        service.runMaintenance();

        verify(rateLimiter).evictIdle();
        verify(cache).evictExpired();
        verify(governor).evictStalePeriods();
    }
}
