package com.wangbin.alerting.monitor.health;

import java.util.Collection;
import java.util.Locale;

/**
 * 健康等级，按声明顺序由好到坏排列
 */
public enum HealthLevel {

    UP,
    /** 检查本身失败，无法判断 */
    UNKNOWN,
    /** 告警仍可处理，但分类、发布或死信有一项不在最佳状态 */
    DEGRADED,
    /** 无法接收告警 */
    DOWN;

    public boolean isWorseThan(HealthLevel other) {
        return other == null || compareTo(other) > 0;
    }

    /**
     * 取最差的等级；没有任何检查时为UP
     */
    public static HealthLevel worstOf(Collection<HealthCheck> checks) {
        HealthLevel worst = UP;
        for (HealthCheck check : checks) {
            if (check != null && check.getLevel() != null && check.getLevel().isWorseThan(worst)) {
                worst = check.getLevel();
            }
        }
        return worst;
    }

    public static HealthLevel parse(Object value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
