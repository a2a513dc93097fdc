package com.wangbin.alerting.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    SUCCESS(200, "成功"),

    // 请求错误
    BAD_REQUEST(400, "请求参数错误"),
    PARAM_ERROR(1000, "参数错误"),

    // 告警处理
    ALERT_VALIDATION_ERROR(2000, "告警校验失败"),
    TARGET_NOT_FOUND(2004, "发布目标不存在"),
    DEAD_LETTER_NOT_FOUND(2006, "死信记录不存在"),
    TARGET_DISABLED(2007, "发布目标已停用"),

    CONFIG_INVALID(3002, "配置无效"),

    SYSTEM_ERROR(5000, "系统内部错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
