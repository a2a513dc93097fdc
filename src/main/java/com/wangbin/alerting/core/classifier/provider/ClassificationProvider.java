package com.wangbin.alerting.core.classifier.provider;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;

import java.time.Duration;

/**
 * 外部分类服务
 */
public interface ClassificationProvider {

    /**
     * 对单条告警分类
     *
     * @param alert   告警
     * @param timeout 本次调用允许的最长时间
     * @return 分类结果，不能为null
     * @throws ClassificationProviderException 调用失败、响应无效或超时
     */
    Classification classify(Alert alert, Duration timeout) throws ClassificationProviderException;

    /**
     * 服务名称，用于日志与统计
     */
    String getName();
}
