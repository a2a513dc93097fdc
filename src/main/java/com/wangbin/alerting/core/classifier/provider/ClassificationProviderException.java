package com.wangbin.alerting.core.classifier.provider;

import lombok.Getter;

/**
 * 外部分类服务调用失败
 */
@Getter
public class ClassificationProviderException extends Exception {

    /** HTTP状态码，未拿到响应时为0 */
    private final int statusCode;

    public ClassificationProviderException(String message) {
        super(message);
        this.statusCode = 0;
    }

    public ClassificationProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ClassificationProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }
}
