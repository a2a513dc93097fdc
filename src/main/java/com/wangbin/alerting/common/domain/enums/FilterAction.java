package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 过滤动作
 */
public enum FilterAction {

    ALLOW("allow"),
    DENY("deny");

    private final String code;

    FilterAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
