package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 告警严重级别
 */
public enum Severity {

    CRITICAL("critical", 3),
    WARNING("warning", 2),
    INFO("info", 1),
    UNKNOWN("unknown", 0);

    private final String code;
    private final int level;

    Severity(String code, int level) {
        this.code = code;
        this.level = level;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getLevel() {
        return level;
    }

    /**
     * 根据code获取枚举，无法识别时返回UNKNOWN
     */
    @JsonCreator
    public static Severity fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        for (Severity severity : values()) {
            if (severity.code.equalsIgnoreCase(code.trim())) {
                return severity;
            }
        }
        return UNKNOWN;
    }
}
