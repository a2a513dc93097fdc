package com.wangbin.alerting.core.publish.formatter;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.Target;
import com.wangbin.alerting.common.domain.enums.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slack 消息格式（blocks + attachments）
 */
@Component
public class SlackFormatter implements AlertFormatter {

    static final String COLOR_CRITICAL = "#FF0000";
    static final String COLOR_WARNING = "#FFA500";
    static final String COLOR_RESOLVED = "#36A64F";
    static final String COLOR_INFO = "#439FE0";

    @Override
    public String getType() {
        return "slack";
    }

    @Override
    public Map<String, Object> format(Alert alert, Classification classification, Target target) {
        String status = alert.isFiring() ? "FIRING" : "RESOLVED";
        String title = String.format("[%s] %s", status, FormatSupport.summary(alert));

        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("Severity", classification.getSeverity().getCode()));
        fields.add(field("Category", classification.getCategory()));
        fields.add(field("Confidence", String.format("%.0f%%", classification.getConfidence() * 100)));
        if (alert.namespace() != null) {
            fields.add(field("Namespace", alert.namespace()));
        }

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", color(alert, classification));
        attachment.put("title", title);
        attachment.put("title_link", alert.getGeneratorUrl());
        attachment.put("text", FormatSupport.description(alert));
        attachment.put("fields", fields);
        attachment.put("footer", FormatSupport.SOURCE_NAME);
        if (alert.getStartsAt() != null) {
            attachment.put("ts", alert.getStartsAt().getEpochSecond());
        }

        Map<String, Object> text = new LinkedHashMap<>();
        text.put("type", "mrkdwn");
        text.put("text", "*" + title + "*");
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("type", "section");
        section.put("text", text);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", title);
        payload.put("blocks", List.of(section));
        payload.put("attachments", List.of(attachment));
        return payload;
    }

    static String color(Alert alert, Classification classification) {
        if (!alert.isFiring()) {
            return COLOR_RESOLVED;
        }
        if (classification.getSeverity() == Severity.CRITICAL) {
            return COLOR_CRITICAL;
        }
        if (classification.getSeverity() == Severity.WARNING) {
            return COLOR_WARNING;
        }
        return COLOR_INFO;
    }

    private static Map<String, Object> field(String title, String value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
        return field;
    }
}
