package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 发布错误码
 */
public enum PublishErrorCode {

    TIMEOUT("timeout", true),
    CONNECTION_ERROR("connection_error", true),
    SERVER_ERROR("server_error", true),
    RATE_LIMITED("rate_limited", true),
    CLIENT_ERROR("client_error", false),
    FORMAT_ERROR("format_error", false),
    DEADLINE_EXCEEDED("deadline_exceeded", false),
    UNKNOWN_ERROR("unknown_error", false);

    private final String code;
    private final boolean retryable;

    PublishErrorCode(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * 根据HTTP状态码推导错误码，状态码0表示未拿到响应
     */
    public static PublishErrorCode fromStatusCode(int statusCode) {
        if (statusCode == 0) {
            return CONNECTION_ERROR;
        }
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        if (statusCode >= 400) {
            return CLIENT_ERROR;
        }
        return UNKNOWN_ERROR;
    }
}
