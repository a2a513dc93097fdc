package com.wangbin.alerting.core.publish.retry;

import com.wangbin.alerting.core.publish.sender.TargetDeliveryException;

/**
 * 重试循环的结果
 *
 * @param retryCount       实际发生的重试次数（不含首次尝试）
 * @param deadlineExceeded 是否因截止时间或中断提前停止
 */
public record RetryResult<T>(boolean success, T value, TargetDeliveryException error,
                             int retryCount, boolean deadlineExceeded) {

    static <T> RetryResult<T> success(T value, int retryCount) {
        return new RetryResult<>(true, value, null, retryCount, false);
    }

    static <T> RetryResult<T> failure(TargetDeliveryException error, int retryCount, boolean deadlineExceeded) {
        return new RetryResult<>(false, null, error, retryCount, deadlineExceeded);
    }
}
