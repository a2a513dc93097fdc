package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 告警状态
 */
public enum AlertStatus {

    FIRING("firing", "触发中"),
    RESOLVED("resolved", "已恢复");

    private final String code;
    private final String description;

    AlertStatus(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 根据code获取枚举，未知返回null
     */
    @JsonCreator
    public static AlertStatus fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AlertStatus status : values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        return null;
    }
}
