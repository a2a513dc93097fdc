package com.wangbin.alerting.core.publish.formatter;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.Target;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按目标类型选择格式化器，未知类型与 generic 使用通用Webhook格式
 */
@Slf4j
@Component
public class FormatterRegistry {

    private final Map<String, AlertFormatter> formatters = new ConcurrentHashMap<>();
    private final AlertFormatter defaultFormatter;

    public FormatterRegistry(List<AlertFormatter> formatterList) {
        for (AlertFormatter formatter : formatterList) {
            formatters.put(formatter.getType().toLowerCase(Locale.ROOT), formatter);
        }
        AlertFormatter webhook = formatters.get(WebhookFormatter.TYPE);
        this.defaultFormatter = webhook != null ? webhook : new WebhookFormatter();
        log.info("已注册格式化器: {}", formatters.keySet());
    }

    public Map<String, Object> format(Alert alert, Classification classification, Target target) {
        return resolve(target.getType()).format(alert, classification, target);
    }

    public AlertFormatter resolve(String type) {
        if (type == null) {
            return defaultFormatter;
        }
        AlertFormatter formatter = formatters.get(type.toLowerCase(Locale.ROOT));
        if (formatter == null) {
            if (!"generic".equalsIgnoreCase(type)) {
                log.debug("未知目标类型，使用通用格式: {}", type);
            }
            return defaultFormatter;
        }
        return formatter;
    }
}
