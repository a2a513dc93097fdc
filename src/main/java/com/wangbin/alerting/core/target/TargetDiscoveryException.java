package com.wangbin.alerting.core.target;

/**
 * 目标发现失败
 */
public class TargetDiscoveryException extends Exception {

    public TargetDiscoveryException(String message) {
        super(message);
    }

    public TargetDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
