package com.wangbin.alerting.core.publish.formatter;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.Target;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alertmanager webhook v4 格式，分类结果写入 annotations
 */
@Component
public class AlertmanagerFormatter implements AlertFormatter {

    @Override
    public String getType() {
        return "alertmanager";
    }

    @Override
    public Map<String, Object> format(Alert alert, Classification classification, Target target) {
        Map<String, String> annotations = new LinkedHashMap<>(alert.getAnnotations());
        annotations.put("classification_severity", classification.getSeverity().getCode());
        annotations.put("classification_category", classification.getCategory());
        annotations.put("classification_confidence", String.format("%.2f", classification.getConfidence()));

        Map<String, Object> item = FormatSupport.alert(alert);
        item.put("annotations", annotations);

        Map<String, Object> groupLabels = new LinkedHashMap<>();
        if (alert.alertName() != null) {
            groupLabels.put("alertname", alert.alertName());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", "4");
        payload.put("groupKey", alert.alertName() != null
                ? "{}:{alertname=\"" + alert.alertName() + "\"}" : "{}:{}");
        payload.put("truncatedAlerts", 0);
        payload.put("status", alert.getStatus().getCode());
        payload.put("receiver", target.getName());
        payload.put("groupLabels", groupLabels);
        payload.put("commonLabels", alert.getLabels());
        payload.put("commonAnnotations", annotations);
        payload.put("externalURL", "");
        payload.put("alerts", List.of(item));
        return payload;
    }
}
