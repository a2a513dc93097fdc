package com.wangbin.alerting.monitor.health;

import com.wangbin.alerting.core.cache.manager.MultiLevelCacheManager;
import com.wangbin.alerting.core.classifier.ClassificationService;
import com.wangbin.alerting.core.classifier.ClassificationStats;
import com.wangbin.alerting.core.mode.ModeManager;
import com.wangbin.alerting.core.mode.ModeSnapshot;
import com.wangbin.alerting.core.publish.dlq.DeadLetterService;
import com.wangbin.alerting.core.publish.dlq.DeadLetterStats;
import com.wangbin.alerting.core.target.TargetRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 聚合服务级健康信息。
 *
 * 熔断打开、指标模式、死信积压都只算降级，分类有本地降级、告警仍可处理。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SystemHealthService {

    /** 死信占用超过该比例视为降级 */
    static final double DLQ_DEGRADED_RATIO = 0.8;

    private final MultiLevelCacheManager multiLevelCacheManager;
    private final ClassificationService classificationService;
    private final ModeManager modeManager;
    private final TargetRegistry targetRegistry;
    private final DeadLetterService deadLetterService;

    public ServiceHealth getSystemHealth() {
        Instant now = Instant.now();
        List<HealthCheck> checks = List.of(
                run("cache", now, this::checkCache),
                run("classifier", now, this::checkClassifier),
                run("publishing", now, this::checkPublishing),
                run("deadLetterQueue", now, this::checkDeadLetters));
        ServiceHealth health = ServiceHealth.of(checks, now);
        if (!health.getDegradedComponents().isEmpty()) {
            log.debug("服务健康: level={}, 异常组件={}", health.getLevel(), health.getDegradedComponents());
        }
        return health;
    }

    /**
     * 没有任何可用缓存层级时为DOWN，部分层级失败为DEGRADED
     */
    private HealthCheck checkCache(Instant now) {
        Map<String, Object> cacheHealth = multiLevelCacheManager.getHealthStatus();
        Map<String, Object> details = new LinkedHashMap<>(cacheHealth);
        details.remove("overallStatus");

        return HealthCheck.builder()
                .component("cache")
                .level(HealthLevel.parse(cacheHealth.get("overallStatus")))
                .summary("分类缓存层级 " + details.getOrDefault("activeLevels", List.of()))
                .details(details)
                .checkedAt(now)
                .build();
    }

    private HealthCheck checkClassifier(Instant now) {
        ClassificationStats stats = classificationService.getStats();
        HealthLevel level;
        String summary;
        if (!stats.isProviderEnabled()) {
            level = HealthLevel.UP;
            summary = "外部分类服务未启用，使用本地降级分类";
        } else if ("CLOSED".equals(stats.getBreakerState())) {
            level = HealthLevel.UP;
            summary = "熔断器关闭";
        } else {
            level = HealthLevel.DEGRADED;
            summary = "熔断器" + stats.getBreakerState() + "，分类降级中";
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("breakerState", stats.getBreakerState());
        details.put("providerEnabled", stats.isProviderEnabled());
        details.put("cacheHitRate", stats.getCacheHitRate());
        details.put("fallbackRate", stats.getFallbackRate());
        details.put("providerFailures", stats.getProviderFailures());

        return HealthCheck.builder()
                .component("classifier")
                .level(level)
                .summary(summary)
                .details(details)
                .checkedAt(now)
                .build();
    }

    /**
     * 指标模式或目标刷新失败只算降级，告警仍会被分类和记录
     */
    private HealthCheck checkPublishing(Instant now) {
        ModeSnapshot snapshot = modeManager.getModeMetrics();
        TargetRegistry.RefreshStatus refresh = targetRegistry.getRefreshStatus();
        boolean refreshFailing = refresh.getLastError() != null;

        String summary;
        if (snapshot.isMetricsOnly()) {
            summary = "无可用目标，仅记录指标";
        } else if (refreshFailing) {
            summary = "目标刷新失败，沿用上次的目标列表";
        } else {
            summary = "发布正常";
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mode", snapshot.getMode().getCode());
        details.put("enabledTargets", snapshot.getEnabledTargets());
        details.put("totalTargets", refresh.getTotalTargets());
        details.put("transitionCount", snapshot.getTransitionCount());
        details.put("lastRefreshError", refresh.getLastError());

        return HealthCheck.builder()
                .component("publishing")
                .level(snapshot.isMetricsOnly() || refreshFailing ? HealthLevel.DEGRADED : HealthLevel.UP)
                .summary(summary)
                .details(details)
                .checkedAt(now)
                .build();
    }

    private HealthCheck checkDeadLetters(Instant now) {
        DeadLetterStats stats = deadLetterService.getStats();
        double usage = stats.getMaxSize() > 0 ? (double) stats.getSize() / stats.getMaxSize() : 0.0;
        boolean backlog = usage >= DLQ_DEGRADED_RATIO;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("size", stats.getSize());
        details.put("maxSize", stats.getMaxSize());
        details.put("usage", usage);
        details.put("totalEvicted", stats.getTotalEvicted());
        details.put("oldestFailedAt", stats.getOldestFailedAt());

        return HealthCheck.builder()
                .component("deadLetterQueue")
                .level(backlog ? HealthLevel.DEGRADED : HealthLevel.UP)
                .summary(backlog ? "死信积压 " + stats.getSize() + "/" + stats.getMaxSize() : "死信队列正常")
                .details(details)
                .checkedAt(now)
                .build();
    }

    private HealthCheck run(String component, Instant now, Function<Instant, HealthCheck> check) {
        try {
            return check.apply(now);
        } catch (RuntimeException e) {
            log.warn("组件健康检查失败: {}", component, e);
            return HealthCheck.failed(component, e, now);
        }
    }
}
