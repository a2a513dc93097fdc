package com.wangbin.alerting.common.domain.entity;

import com.wangbin.alerting.common.domain.enums.AlertStatus;
import com.wangbin.alerting.common.utils.FingerprintUtil;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 告警实体
 *
 * 创建后不可变，在流水线中按值传递。
 * endsAt 为 null 表示告警仍在触发中。
 */
@Getter
@ToString
@EqualsAndHashCode
public class Alert {

    private final String fingerprint;
    private final AlertStatus status;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final Instant startsAt;
    private final Instant endsAt;
    private final String generatorUrl;

    @Builder(toBuilder = true)
    @Jacksonized
    public Alert(String fingerprint, AlertStatus status, Map<String, String> labels,
                 Map<String, String> annotations, Instant startsAt, Instant endsAt,
                 String generatorUrl) {
        this.labels = labels == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(labels));
        this.annotations = annotations == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(annotations));
        this.fingerprint = fingerprint == null || fingerprint.isBlank()
                ? FingerprintUtil.fromLabels(this.labels)
                : fingerprint;
        this.status = status == null ? AlertStatus.FIRING : status;
        this.startsAt = startsAt;
        this.endsAt = endsAt;
        this.generatorUrl = generatorUrl;
    }

    public String alertName() {
        return labels.get("alertname");
    }

    public String namespace() {
        return labels.get("namespace");
    }

    public String label(String name) {
        return labels.get(name);
    }

    public boolean isFiring() {
        return status == AlertStatus.FIRING;
    }
}
