package com.wangbin.alerting.common.domain.entity;

import com.wangbin.alerting.common.domain.enums.ClassificationSource;
import com.wangbin.alerting.common.domain.enums.Severity;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;

/**
 * 告警分类结果
 *
 * confidence 始终落在 [0,1] 区间内，构造时越界值被截断。
 */
@Getter
@ToString
@EqualsAndHashCode
public class Classification {

    private final Severity severity;
    private final String category;
    private final double confidence;
    private final ClassificationSource source;
    private final String reasoning;
    private final List<String> recommendations;

    @Builder(toBuilder = true)
    @Jacksonized
    public Classification(Severity severity, String category, double confidence,
                          ClassificationSource source, String reasoning,
                          List<String> recommendations) {
        this.severity = severity == null ? Severity.UNKNOWN : severity;
        this.category = category == null || category.isBlank() ? "general" : category;
        this.confidence = clamp(confidence);
        this.source = source;
        this.reasoning = reasoning;
        this.recommendations = recommendations == null ? Collections.emptyList()
                : Collections.unmodifiableList(List.copyOf(recommendations));
    }

    /**
     * 返回来源替换后的副本（缓存命中时使用）
     */
    public Classification withSource(ClassificationSource newSource) {
        return toBuilder().source(newSource).build();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
