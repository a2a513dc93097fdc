package com.wangbin.alerting.core.publish.sender;

import com.wangbin.alerting.common.domain.entity.Target;

import java.time.Duration;

/**
 * 向目标发出一次投递调用
 */
public interface TargetSender {

    /**
     * @param payload 已格式化的JSON载荷
     * @param timeout 本次调用超时
     * @return 成功时的HTTP状态码
     * @throws TargetDeliveryException 非2xx响应、超时或连接错误
     */
    int send(Target target, String payload, Duration timeout) throws TargetDeliveryException;
}
