package com.wangbin.alerting.core.publish.formatter;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.Target;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rootly 事件格式
 */
@Component
public class RootlyFormatter implements AlertFormatter {

    @Override
    public String getType() {
        return "rootly";
    }

    @Override
    public Map<String, Object> format(Alert alert, Classification classification, Target target) {
        List<String> tags = new ArrayList<>();
        alert.getLabels().forEach((k, v) -> tags.add(k + ":" + v));

        StringBuilder description = new StringBuilder(FormatSupport.description(alert));
        if (classification.getReasoning() != null) {
            if (description.length() > 0) {
                description.append("\n\n");
            }
            description.append("Classification: ").append(classification.getReasoning());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", "[" + classification.getSeverity().getCode().toUpperCase() + "] "
                + FormatSupport.summary(alert));
        payload.put("description", description.toString());
        payload.put("severity", severity(classification));
        payload.put("status", alert.isFiring() ? "open" : "resolved");
        payload.put("external_id", alert.getFingerprint());
        payload.put("started_at", FormatSupport.time(alert.getStartsAt()));
        payload.put("ended_at", FormatSupport.time(alert.getEndsAt()));
        payload.put("source", FormatSupport.SOURCE_NAME);
        payload.put("tags", tags);
        payload.put("recommendations", classification.getRecommendations());
        return payload;
    }

    private static String severity(Classification classification) {
        switch (classification.getSeverity()) {
            case CRITICAL:
                return "critical";
            case WARNING:
                return "major";
            case INFO:
                return "minor";
            default:
                return "low";
        }
    }
}
