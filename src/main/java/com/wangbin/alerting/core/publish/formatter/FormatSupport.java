package com.wangbin.alerting.core.publish.formatter;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 格式化器共用的字段提取
 */
final class FormatSupport {

    static final String SOURCE_NAME = "alert-publishing-service";

    private FormatSupport() {
    }

    static String summary(Alert alert) {
        String summary = alert.getAnnotations().get("summary");
        if (summary != null && !summary.isBlank()) {
            return summary;
        }
        String name = alert.alertName();
        return name != null ? name : "Alert " + alert.getFingerprint();
    }

    static String description(Alert alert) {
        String description = alert.getAnnotations().get("description");
        return description != null ? description : "";
    }

    static String time(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    static Map<String, Object> classification(Classification classification) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("severity", classification.getSeverity().getCode());
        map.put("category", classification.getCategory());
        map.put("confidence", classification.getConfidence());
        map.put("source", classification.getSource() != null ? classification.getSource().getCode() : null);
        map.put("reasoning", classification.getReasoning());
        map.put("recommendations", classification.getRecommendations());
        return map;
    }

    static Map<String, Object> alert(Alert alert) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("fingerprint", alert.getFingerprint());
        map.put("status", alert.getStatus().getCode());
        map.put("labels", alert.getLabels());
        map.put("annotations", alert.getAnnotations());
        map.put("startsAt", time(alert.getStartsAt()));
        map.put("endsAt", time(alert.getEndsAt()));
        map.put("generatorURL", alert.getGeneratorUrl());
        return map;
    }
}
