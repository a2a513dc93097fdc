package com.wangbin.alerting.core.classifier;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.enums.ClassificationSource;
import com.wangbin.alerting.common.domain.enums.Severity;
import com.wangbin.alerting.core.classifier.config.ClassificationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 基于标签的降级分类
 *
 * 纯函数，不会失败：严重级别取自 labels.severity 的固定映射（缺省 info），
 * 类别取自告警名关键字表，置信度固定。
 */
@Component
public class FallbackClassifier {

    private static final Map<String, Severity> SEVERITY_TABLE = new LinkedHashMap<>();

    // 按顺序匹配，先命中者生效
    private static final Map<String, List<String>> CATEGORY_KEYWORDS = new LinkedHashMap<>();

    static {
        for (String value : List.of("critical", "crit", "page", "p1", "emergency", "fatal")) {
            SEVERITY_TABLE.put(value, Severity.CRITICAL);
        }
        for (String value : List.of("warning", "warn", "major", "high", "p2")) {
            SEVERITY_TABLE.put(value, Severity.WARNING);
        }
        for (String value : List.of("info", "minor", "low", "none", "p3", "p4")) {
            SEVERITY_TABLE.put(value, Severity.INFO);
        }

        CATEGORY_KEYWORDS.put("infrastructure", List.of("nodedown", "nodenotready", "hostdown", "instancedown", "node"));
        CATEGORY_KEYWORDS.put("database", List.of("database", "postgres", "mysql", "mongo", "redis", "replication"));
        CATEGORY_KEYWORDS.put("kubernetes", List.of("kube", "pod", "container", "deployment", "crashloop"));
        CATEGORY_KEYWORDS.put("storage", List.of("disk", "volume", "filesystem", "storage", "inode"));
        CATEGORY_KEYWORDS.put("resource", List.of("cpu", "memory", "oom", "highload", "throttl"));
        CATEGORY_KEYWORDS.put("security", List.of("security", "cert", "unauthorized", "auth", "intrusion"));
        CATEGORY_KEYWORDS.put("network", List.of("network", "dns", "packet", "connection"));
        CATEGORY_KEYWORDS.put("performance", List.of("latency", "slow", "responsetime", "queue"));
        CATEGORY_KEYWORDS.put("application", List.of("error", "exception", "5xx", "http"));
        CATEGORY_KEYWORDS.put("availability", List.of("down", "unavailable", "unreachable", "outage"));
    }

    private final double confidence;

    public FallbackClassifier(ClassificationProperties properties) {
        this.confidence = properties.getFallbackConfidence();
    }

    public Classification classify(Alert alert) {
        Severity severity = mapSeverity(alert.label("severity"));
        String category = mapCategory(alert.alertName());
        return Classification.builder()
                .severity(severity)
                .category(category)
                .confidence(confidence)
                .source(ClassificationSource.FALLBACK)
                .reasoning("基于标签规则的降级分类: severity=" + severity.getCode() + ", category=" + category)
                .recommendations(recommendations(severity, category))
                .build();
    }

    static Severity mapSeverity(String label) {
        if (label == null) {
            return Severity.INFO;
        }
        return SEVERITY_TABLE.getOrDefault(label.trim().toLowerCase(Locale.ROOT), Severity.INFO);
    }

    static String mapCategory(String alertName) {
        if (alertName == null || alertName.isBlank()) {
            return "general";
        }
        String name = alertName.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : CATEGORY_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (name.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return "general";
    }

    private List<String> recommendations(Severity severity, String category) {
        List<String> result = new ArrayList<>();
        if (severity == Severity.CRITICAL) {
            result.add("立即排查，确认影响范围");
        } else if (severity == Severity.WARNING) {
            result.add("关注趋势，必要时介入处理");
        } else {
            result.add("记录观察，无需立即处理");
        }
        if (!"general".equals(category)) {
            result.add("检查 " + category + " 相关组件状态");
        }
        return result;
    }
}
