package com.wangbin.alerting.common.exception;

import com.wangbin.alerting.common.web.result.ResultCode;
import lombok.Getter;

import java.util.List;

/**
 * 告警校验异常，请求在进入处理流水线之前被拒绝（HTTP 400）
 */
@Getter
public class AlertValidationException extends BusinessException {

    private final List<String> errors;

    public AlertValidationException(List<String> errors) {
        super(ResultCode.ALERT_VALIDATION_ERROR,
                ResultCode.ALERT_VALIDATION_ERROR.getMessage() + ": " + String.join("; ", errors),
                errors);
        this.errors = List.copyOf(errors);
    }
}
