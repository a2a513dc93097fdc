package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 单条告警的处理结果
 */
public enum AlertOutcome {

    /** 已放行且所有目标发布成功（含零目标） */
    PROCESSED("processed"),
    /** 被过滤规则拒绝 */
    FILTERED("filtered"),
    /** 部分目标发布失败 */
    PARTIAL("partial"),
    /** 全部目标失败、处理异常或超时 */
    FAILED("failed");

    private final String code;

    AlertOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
