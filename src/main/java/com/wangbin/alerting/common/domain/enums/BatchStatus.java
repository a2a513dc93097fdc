package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 批次整体状态，对应HTTP 200 / 207 / 500
 */
public enum BatchStatus {

    SUCCESS("success", 200),
    PARTIAL("partial", 207),
    FAILED("failed", 500);

    private final String code;
    private final int httpStatus;

    BatchStatus(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
