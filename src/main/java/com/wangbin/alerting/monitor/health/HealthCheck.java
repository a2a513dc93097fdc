package com.wangbin.alerting.monitor.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 单个组件的一次健康检查结果
 */
@Value
@Builder
public class HealthCheck {

    /** cache / classifier / publishing / deadLetterQueue */
    String component;
    HealthLevel level;
    String summary;
    Map<String, Object> details;
    Instant checkedAt;

    public Map<String, Object> getDetails() {
        return details == null ? Map.of() : details;
    }

    public static HealthCheck failed(String component, Exception error, Instant now) {
        return HealthCheck.builder()
                .component(component)
                .level(HealthLevel.UNKNOWN)
                .summary("健康检查失败: " + error.getMessage())
                .checkedAt(now)
                .build();
    }
}
