package com.wangbin.alerting.common.web.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * 统一API响应结果，用于操作类接口与错误响应
 */
@Data
public class ApiResult<T> {

    private int code;
    private String message;
    private T data;
    private long timestamp;

    public ApiResult() {
        this.timestamp = System.currentTimeMillis();
    }

    public static <T> ApiResult<T> success(T data) {
        return of(ResultCode.SUCCESS.getCode(), ResultCode.SUCCESS.getMessage(), data);
    }

    public static <T> ApiResult<T> success(String message, T data) {
        return of(ResultCode.SUCCESS.getCode(), message, data);
    }

    public static <T> ApiResult<T> error(int code, String message) {
        return of(code, message, null);
    }

    /**
     * 带明细的错误响应，如校验错误列表
     */
    public static <T> ApiResult<T> error(int code, String message, T details) {
        return of(code, message, details);
    }

    private static <T> ApiResult<T> of(int code, String message, T data) {
        ApiResult<T> result = new ApiResult<>();
        result.setCode(code);
        result.setMessage(message);
        result.setData(data);
        return result;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return this.code == ResultCode.SUCCESS.getCode();
    }
}
