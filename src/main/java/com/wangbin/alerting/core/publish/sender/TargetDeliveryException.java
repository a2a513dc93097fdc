package com.wangbin.alerting.core.publish.sender;

import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import lombok.Getter;

/**
 * 单次投递失败
 */
@Getter
public class TargetDeliveryException extends Exception {

    /** HTTP状态码，未拿到响应时为0 */
    private final int statusCode;
    private final PublishErrorCode errorCode;

    public TargetDeliveryException(PublishErrorCode errorCode, int statusCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
    }

    public TargetDeliveryException(PublishErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.statusCode = 0;
    }

    public static TargetDeliveryException ofStatus(int statusCode, String message) {
        return new TargetDeliveryException(PublishErrorCode.fromStatusCode(statusCode), statusCode, message);
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
