package com.wangbin.alerting.core.publish.retry;

import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import com.wangbin.alerting.common.utils.Deadline;
import com.wangbin.alerting.core.publish.sender.TargetDeliveryException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 显式的有界重试循环
 *
 * 不可重试错误立即返回；退避等待会越过截止时间时停止重试。
 */
@Slf4j
public class RetryExecutor {

    @FunctionalInterface
    public interface Attempt<T> {
        /**
         * @param attemptNumber 从0开始的尝试序号
         */
        T run(int attemptNumber) throws TargetDeliveryException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    @Getter
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, Thread::sleep);
    }

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public <T> RetryResult<T> execute(String operation, Attempt<T> attempt, Deadline deadline) {
        int retries = 0;
        TargetDeliveryException lastError = null;

        while (true) {
            if (deadline.isExpired()) {
                return RetryResult.failure(deadlineError(lastError), retries, true);
            }

            try {
                T value = attempt.run(retries);
                if (retries > 0) {
                    log.info("重试成功: {}, 重试次数={}", operation, retries);
                }
                return RetryResult.success(value, retries);
            } catch (TargetDeliveryException e) {
                lastError = e;
                if (!policy.isRetryable(e.getErrorCode())) {
                    log.warn("不可重试错误，放弃: {}, code={}, error={}", operation, e.getErrorCode(), e.getMessage());
                    return RetryResult.failure(e, retries, false);
                }
                if (retries >= policy.getMaxRetries()) {
                    log.warn("重试次数耗尽: {}, 重试次数={}, error={}", operation, retries, e.getMessage());
                    return RetryResult.failure(e, retries, false);
                }

                long backoff = policy.backoffMillis(retries + 1);
                if (backoff >= deadline.remainingMillis()) {
                    log.warn("剩余时间不足以重试: {}, backoff={}ms, remaining={}ms",
                            operation, backoff, deadline.remainingMillis());
                    return RetryResult.failure(e, retries, true);
                }

                log.debug("准备重试: {}, 第{}次, 等待{}ms, error={}", operation, retries + 1, backoff, e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return RetryResult.failure(e, retries, true);
                }
                retries++;
            }
        }
    }

    private static TargetDeliveryException deadlineError(TargetDeliveryException lastError) {
        if (lastError != null) {
            return lastError;
        }
        return new TargetDeliveryException(PublishErrorCode.DEADLINE_EXCEEDED, 0, "请求截止时间已到");
    }
}
