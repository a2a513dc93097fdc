package com.wangbin.alerting.core.publish.formatter;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.Target;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PagerDuty Events API v2 格式，dedup_key 使用告警指纹
 */
@Component
public class PagerDutyFormatter implements AlertFormatter {

    /** 目标 headers 中携带的 routing key */
    static final String ROUTING_KEY_HEADER = "X-Routing-Key";

    @Override
    public String getType() {
        return "pagerduty";
    }

    @Override
    public Map<String, Object> format(Alert alert, Classification classification, Target target) {
        Map<String, Object> payload = new LinkedHashMap<>();
        String routingKey = target.getHeaders().get(ROUTING_KEY_HEADER);
        if (routingKey != null) {
            payload.put("routing_key", routingKey);
        }
        payload.put("event_action", alert.isFiring() ? "trigger" : "resolve");
        payload.put("dedup_key", alert.getFingerprint());

        if (alert.isFiring()) {
            Map<String, Object> customDetails = new LinkedHashMap<>();
            customDetails.put("labels", alert.getLabels());
            customDetails.put("annotations", alert.getAnnotations());
            customDetails.put("classification", FormatSupport.classification(classification));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("summary", FormatSupport.summary(alert));
            body.put("severity", severity(classification));
            body.put("source", alert.label("instance") != null ? alert.label("instance") : FormatSupport.SOURCE_NAME);
            body.put("timestamp", FormatSupport.time(alert.getStartsAt()));
            body.put("component", alert.label("job"));
            body.put("group", alert.namespace());
            body.put("class", classification.getCategory());
            body.put("custom_details", customDetails);
            payload.put("payload", body);

            if (alert.getGeneratorUrl() != null) {
                payload.put("links", List.of(Map.of("href", alert.getGeneratorUrl(), "text", "Source")));
            }
        }
        return payload;
    }

    private static String severity(Classification classification) {
        switch (classification.getSeverity()) {
            case CRITICAL:
                return "critical";
            case WARNING:
                return "warning";
            case INFO:
                return "info";
            default:
                return "error";
        }
    }
}
