package com.wangbin.alerting.monitor.health;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 告警服务整体健康
 *
 * 整体等级取各组件中最差的一个。只有DOWN会让服务拒绝接收告警，
 * 降级组件单独列出，便于定位是分类、发布还是死信出了问题。
 */
@Value
public class ServiceHealth {

    HealthLevel level;
    boolean acceptingAlerts;
    List<String> degradedComponents;
    Map<String, HealthCheck> checks;
    Instant checkedAt;

    public static ServiceHealth of(List<HealthCheck> checks, Instant now) {
        Map<String, HealthCheck> byComponent = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            if (check != null) {
                byComponent.put(check.getComponent(), check);
            }
        }
        HealthLevel level = HealthLevel.worstOf(byComponent.values());
        List<String> degraded = byComponent.values().stream()
                .filter(check -> check.getLevel() != HealthLevel.UP)
                .map(HealthCheck::getComponent)
                .collect(Collectors.toList());
        return new ServiceHealth(level, level != HealthLevel.DOWN, degraded,
                Collections.unmodifiableMap(byComponent), now);
    }
}
