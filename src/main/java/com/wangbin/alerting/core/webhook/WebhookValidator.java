package com.wangbin.alerting.core.webhook;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertStatus;
import com.wangbin.alerting.common.exception.AlertValidationException;
import com.wangbin.alerting.core.processor.config.WebhookProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Webhook请求校验与转换
 *
 * 收集全部问题后一次性抛出 {@link AlertValidationException}，
 * 校验失败的请求不会进入处理流水线。
 */
@Slf4j
@Component
public class WebhookValidator {

    static final int MAX_LABEL_NAME_LENGTH = 255;
    static final int MAX_LABEL_VALUE_LENGTH = 8192;

    private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    /** Alertmanager 用零时间表示“未结束” */
    private static final Instant ZERO_TIME = Instant.parse("0001-01-01T00:00:00Z");

    private final int maxAlerts;
    private final Clock clock;

    public WebhookValidator(WebhookProperties properties) {
        this(properties.getMaxAlertsPerRequest(), Clock.systemUTC());
    }

    public WebhookValidator(int maxAlerts, Clock clock) {
        this.maxAlerts = maxAlerts;
        this.clock = clock;
    }

    /**
     * 校验请求并转换为告警列表
     *
     * @throws AlertValidationException 存在任何校验错误
     */
    public List<Alert> toAlerts(WebhookRequest request) {
        List<String> errors = new ArrayList<>();
        if (request == null) {
            throw new AlertValidationException(List.of("请求体不能为空"));
        }
        List<WebhookRequest.AlertItem> items = request.getAlerts();
        if (items == null || items.isEmpty()) {
            throw new AlertValidationException(List.of("alerts 不能为空"));
        }
        if (items.size() > maxAlerts) {
            throw new AlertValidationException(List.of(
                    "告警数量超过上限: " + items.size() + " > " + maxAlerts));
        }

        Instant receivedAt = clock.instant();
        List<Alert> alerts = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Alert alert = validateItem(i, items.get(i), receivedAt, errors);
            if (alert != null) {
                alerts.add(alert);
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Webhook校验失败: receiver={}, 错误数={}", request.getReceiver(), errors.size());
            throw new AlertValidationException(errors);
        }
        return alerts;
    }

    private Alert validateItem(int index, WebhookRequest.AlertItem item, Instant receivedAt, List<String> errors) {
        String prefix = "alerts[" + index + "]";
        if (item == null) {
            errors.add(prefix + ": 告警不能为空");
            return null;
        }
        int before = errors.size();

        AlertStatus status = AlertStatus.fromCode(item.getStatus());
        if (status == null) {
            errors.add(prefix + ".status: 必须为 firing 或 resolved，实际为 " + item.getStatus());
        }

        validateLabels(prefix, item.getLabels(), errors);

        Instant startsAt = parseTime(prefix + ".startsAt", item.getStartsAt(), errors);
        Instant endsAt = parseTime(prefix + ".endsAt", item.getEndsAt(), errors);
        if (startsAt == null) {
            startsAt = receivedAt;
        }
        if (endsAt != null && endsAt.isBefore(startsAt)) {
            errors.add(prefix + ".endsAt: 不能早于 startsAt");
        }

        if (errors.size() > before) {
            return null;
        }
        return Alert.builder()
                .fingerprint(item.getFingerprint())
                .status(status)
                .labels(item.getLabels())
                .annotations(item.getAnnotations())
                .startsAt(startsAt)
                .endsAt(endsAt)
                .generatorUrl(item.getGeneratorUrl())
                .build();
    }

    private void validateLabels(String prefix, Map<String, String> labels, List<String> errors) {
        if (labels == null || labels.isEmpty()) {
            errors.add(prefix + ".labels: 不能为空");
            return;
        }
        for (Map.Entry<String, String> label : labels.entrySet()) {
            String name = label.getKey();
            String value = label.getValue();
            if (name == null || !LABEL_NAME.matcher(name).matches()) {
                errors.add(prefix + ".labels: 非法标签名 " + name);
            } else if (name.length() > MAX_LABEL_NAME_LENGTH) {
                errors.add(prefix + ".labels: 标签名过长 " + name.substring(0, 32) + "...");
            }
            if (value == null) {
                errors.add(prefix + ".labels." + name + ": 标签值不能为空");
            } else if (value.length() > MAX_LABEL_VALUE_LENGTH) {
                errors.add(prefix + ".labels." + name + ": 标签值超过 " + MAX_LABEL_VALUE_LENGTH + " 字符");
            } else if (containsControlChar(value)) {
                errors.add(prefix + ".labels." + name + ": 标签值包含控制字符");
            }
        }
    }

    private static Instant parseTime(String field, String value, List<String> errors) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            Instant instant = OffsetDateTime.parse(value.trim()).toInstant();
            return ZERO_TIME.equals(instant) ? null : instant;
        } catch (DateTimeParseException e) {
            errors.add(field + ": 时间格式无效 " + value);
            return null;
        }
    }

    /**
     * 只拒绝 0x00-0x1F 中除制表符、换行、回车以外的字符；多行查询语句等标签值允许换行
     */
    private static boolean containsControlChar(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
        }
        return false;
    }
}
