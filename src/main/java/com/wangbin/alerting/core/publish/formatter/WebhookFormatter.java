package com.wangbin.alerting.core.publish.formatter;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.Target;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通用Webhook格式，也是未知类型的默认格式
 */
@Component
public class WebhookFormatter implements AlertFormatter {

    public static final String TYPE = "webhook";

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> format(Alert alert, Classification classification, Target target) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", FormatSupport.SOURCE_NAME);
        payload.put("target", target.getName());
        payload.put("alert", FormatSupport.alert(alert));
        payload.put("classification", FormatSupport.classification(classification));
        return payload;
    }
}
