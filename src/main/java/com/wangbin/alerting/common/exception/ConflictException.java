package com.wangbin.alerting.common.exception;

import com.wangbin.alerting.common.web.result.ResultCode;

/**
 * 请求与资源当前状态冲突（HTTP 409）
 */
public class ConflictException extends BusinessException {

    public ConflictException(ResultCode resultCode, String message) {
        super(resultCode, message);
    }
}
