package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 分类结果来源
 */
public enum ClassificationSource {

    PROVIDER("provider"),
    CACHE("cache"),
    FALLBACK("fallback");

    private final String code;

    ClassificationSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ClassificationSource fromCode(String code) {
        for (ClassificationSource source : values()) {
            if (source.code.equalsIgnoreCase(code)) {
                return source;
            }
        }
        throw new IllegalArgumentException("未知的分类来源: " + code);
    }
}
