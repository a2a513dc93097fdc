package com.wangbin.alerting.core.publish.retry;

import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import com.wangbin.alerting.core.publish.config.PublishingProperties;
import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * 重试策略：最大重试次数、退避序列、可重试判定
 */
@Getter
public class RetryPolicy {

    private final int maxRetries;
    private final List<Duration> backoff;

    public RetryPolicy(int maxRetries, List<Duration> backoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries不能为负数: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.backoff = backoff == null || backoff.isEmpty() ? List.of(Duration.ZERO) : List.copyOf(backoff);
    }

    public static RetryPolicy from(PublishingProperties.Retry config) {
        return new RetryPolicy(config.getMaxRetries(), config.getBackoff());
    }

    /**
     * 超时、连接错误、5xx、429 可重试；其余 4xx、格式错误不可重试
     */
    public boolean isRetryable(PublishErrorCode errorCode) {
        return errorCode != null && errorCode.isRetryable();
    }

    /**
     * 第 retryNumber 次重试（从1开始）前的等待时间
     */
    public long backoffMillis(int retryNumber) {
        int index = Math.min(Math.max(retryNumber, 1), backoff.size()) - 1;
        return backoff.get(index).toMillis();
    }
}
