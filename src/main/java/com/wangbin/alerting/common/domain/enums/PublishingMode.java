package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 发布模式
 * NORMAL: 存在可用目标，正常发布
 * METRICS_ONLY: 无可用目标，仅分类和过滤
 */
public enum PublishingMode {

    NORMAL("normal"),
    METRICS_ONLY("metrics-only");

    private final String code;

    PublishingMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
