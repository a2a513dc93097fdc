package com.wangbin.alerting.monitor.health;

import com.wangbin.alerting.common.domain.enums.PublishingMode;
import com.wangbin.alerting.core.cache.manager.MultiLevelCacheManager;
import com.wangbin.alerting.core.classifier.ClassificationService;
import com.wangbin.alerting.core.classifier.ClassificationStats;
import com.wangbin.alerting.core.mode.ModeManager;
import com.wangbin.alerting.core.mode.ModeSnapshot;
import com.wangbin.alerting.core.publish.dlq.DeadLetterService;
import com.wangbin.alerting.core.publish.dlq.DeadLetterStats;
import com.wangbin.alerting.core.target.TargetRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SystemHealthServiceTest {

    private final MultiLevelCacheManager cacheManager = mock(MultiLevelCacheManager.class);
    private final ClassificationService classificationService = mock(ClassificationService.class);
    private final ModeManager modeManager = mock(ModeManager.class);
    private final TargetRegistry targetRegistry = mock(TargetRegistry.class);
    private final DeadLetterService deadLetterService = mock(DeadLetterService.class);

    private SystemHealthService service;

    @BeforeEach
    void setUp() {
        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("overallStatus", "UP");
        cache.put("activeLevels", List.of("LOCAL"));
        when(cacheManager.getHealthStatus()).thenReturn(cache);
        when(classificationService.getStats()).thenReturn(breaker("CLOSED"));
        when(modeManager.getModeMetrics()).thenReturn(mode(PublishingMode.NORMAL, 2));
        when(targetRegistry.getRefreshStatus()).thenReturn(TargetRegistry.RefreshStatus.builder()
                .totalTargets(2).enabledTargets(2).build());
        when(deadLetterService.getStats()).thenReturn(DeadLetterStats.builder().size(0).maxSize(100).build());

        service = new SystemHealthService(cacheManager, classificationService, modeManager,
                targetRegistry, deadLetterService);
    }

    private static ClassificationStats breaker(String state) {
        return ClassificationStats.builder().providerEnabled(true).breakerState(state).build();
    }

    private static ModeSnapshot mode(PublishingMode mode, int enabled) {
        return ModeSnapshot.builder().mode(mode).enabledTargets(enabled).build();
    }

    @Test
    void allComponentsHealthy() {
        ServiceHealth health = service.getSystemHealth();

        assertEquals(HealthLevel.UP, health.getLevel());
        assertTrue(health.isAcceptingAlerts());
        assertEquals(List.of("cache", "classifier", "publishing", "deadLetterQueue"),
                List.copyOf(health.getChecks().keySet()));
    }

    @Test
    void openBreakerAndMetricsOnlyModeDegradeButKeepIntake() {
        when(classificationService.getStats()).thenReturn(breaker("OPEN"));
        when(modeManager.getModeMetrics()).thenReturn(mode(PublishingMode.METRICS_ONLY, 0));

        ServiceHealth health = service.getSystemHealth();

        assertEquals(HealthLevel.DEGRADED, health.getLevel());
        assertTrue(health.isAcceptingAlerts());
        assertEquals(List.of("classifier", "publishing"), health.getDegradedComponents());
        assertEquals("metrics-only", health.getChecks().get("publishing").getDetails().get("mode"));
    }

    @Test
    void deadLetterBacklogDegrades() {
        when(deadLetterService.getStats()).thenReturn(DeadLetterStats.builder().size(85).maxSize(100).build());

        ServiceHealth health = service.getSystemHealth();

        assertEquals(List.of("deadLetterQueue"), health.getDegradedComponents());
        assertEquals(0.85, (double) health.getChecks().get("deadLetterQueue").getDetails().get("usage"), 1e-9);
    }

    @Test
    void failingCheckIsReportedAsUnknown() {
        when(deadLetterService.getStats()).thenThrow(new IllegalStateException("queue unavailable"));

        ServiceHealth health = service.getSystemHealth();

        HealthCheck check = health.getChecks().get("deadLetterQueue");
        assertEquals(HealthLevel.UNKNOWN, check.getLevel());
        assertTrue(check.getSummary().contains("queue unavailable"));
        assertEquals(HealthLevel.UNKNOWN, health.getLevel());
    }

    @Test
    void cacheWithoutLevelsStopsIntake() {
        when(cacheManager.getHealthStatus()).thenReturn(Map.of("overallStatus", "DOWN"));

        ServiceHealth health = service.getSystemHealth();

        assertEquals(HealthLevel.DOWN, health.getLevel());
        assertFalse(health.isAcceptingAlerts());
    }
}
