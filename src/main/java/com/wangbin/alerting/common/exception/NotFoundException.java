package com.wangbin.alerting.common.exception;

import com.wangbin.alerting.common.web.result.ResultCode;

/**
 * 资源不存在（HTTP 404）
 */
public class NotFoundException extends BusinessException {

    public NotFoundException(ResultCode resultCode, String message) {
        super(resultCode, message);
    }
}
