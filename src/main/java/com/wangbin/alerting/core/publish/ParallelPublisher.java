package com.wangbin.alerting.core.publish;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.PublishResult;
import com.wangbin.alerting.common.domain.entity.Target;
import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import com.wangbin.alerting.common.utils.Deadline;
import com.wangbin.alerting.common.utils.JsonUtil;
import com.wangbin.alerting.core.publish.config.PublishingProperties;
import com.wangbin.alerting.core.publish.dlq.DeadLetterEntry;
import com.wangbin.alerting.core.publish.dlq.DeadLetterQueue;
import com.wangbin.alerting.core.publish.formatter.FormatterRegistry;
import com.wangbin.alerting.core.publish.retry.RetryExecutor;
import com.wangbin.alerting.core.publish.retry.RetryPolicy;
import com.wangbin.alerting.core.publish.retry.RetryResult;
import com.wangbin.alerting.core.publish.sender.TargetDeliveryException;
import com.wangbin.alerting.core.publish.sender.TargetSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * 多目标并行发布
 *
 * 每个启用的目标一个工作单元，单次调用内由信号量限制并发。
 * 结果按目标顺序返回，某个目标失败不影响其它目标。不做去重。
 */
@Slf4j
@Service
public class ParallelPublisher {

    private final PublishingProperties properties;
    private final FormatterRegistry formatterRegistry;
    private final TargetSender sender;
    private final DeadLetterQueue deadLetterQueue;
    private final ExecutorService publishExecutor;
    private final RetryExecutor retryExecutor;

    private final AtomicLong totalPublishes = new AtomicLong(0);
    private final AtomicLong successfulPublishes = new AtomicLong(0);
    private final AtomicLong failedPublishes = new AtomicLong(0);
    private final AtomicLong totalRetries = new AtomicLong(0);
    private final AtomicLong deadLettered = new AtomicLong(0);
    private final AtomicLong deadlineExceeded = new AtomicLong(0);
    private final Map<String, TargetCounter> targetCounters = new ConcurrentHashMap<>();

    @Autowired
    public ParallelPublisher(PublishingProperties properties,
                             FormatterRegistry formatterRegistry,
                             TargetSender sender,
                             DeadLetterQueue deadLetterQueue,
                             @Qualifier("publishExecutor") ExecutorService publishExecutor) {
        this(properties, formatterRegistry, sender, deadLetterQueue, publishExecutor,
                new RetryExecutor(RetryPolicy.from(properties.getRetry())));
    }

    public ParallelPublisher(PublishingProperties properties,
                             FormatterRegistry formatterRegistry,
                             TargetSender sender,
                             DeadLetterQueue deadLetterQueue,
                             ExecutorService publishExecutor,
                             RetryExecutor retryExecutor) {
        this.properties = properties;
        this.formatterRegistry = formatterRegistry;
        this.sender = sender;
        this.deadLetterQueue = deadLetterQueue;
        this.publishExecutor = publishExecutor;
        this.retryExecutor = retryExecutor;
    }

    /**
     * 并行发布到所有启用的目标，等待全部完成或截止时间到达
     *
     * @return 与启用目标顺序一致的结果，没有启用目标时为空列表
     */
    public List<PublishResult> publishToTargets(Alert alert, Classification classification,
                                                List<Target> targets, Deadline deadline) {
        List<Target> enabled = targets == null ? List.of()
                : targets.stream().filter(Target::isEnabled).collect(Collectors.toList());
        if (enabled.isEmpty()) {
            return List.of();
        }

        long start = System.currentTimeMillis();
        Semaphore semaphore = new Semaphore(Math.max(1, properties.getMaxConcurrency()));
        List<Future<PublishResult>> futures = new ArrayList<>(enabled.size());
        PublishResult[] results = new PublishResult[enabled.size()];

        for (int i = 0; i < enabled.size(); i++) {
            Target target = enabled.get(i);
            if (!acquire(semaphore, deadline)) {
                // 截止时间前拿不到许可，剩余目标不再启动
                futures.add(null);
                continue;
            }
            try {
                futures.add(publishExecutor.submit(() -> {
                    try {
                        return publishOne(alert, classification, target, deadline, true);
                    } finally {
                        semaphore.release();
                    }
                }));
            } catch (RejectedExecutionException e) {
                semaphore.release();
                log.error("发布线程池已满，目标未投递: target={}, fingerprint={}",
                        target.getName(), alert.getFingerprint());
                results[i] = failure(target, PublishErrorCode.UNKNOWN_ERROR, "发布线程池已满", 0, 0);
                futures.add(null);
            }
        }

        for (int i = 0; i < enabled.size(); i++) {
            if (results[i] != null) {
                continue;
            }
            Target target = enabled.get(i);
            Future<PublishResult> future = futures.get(i);
            if (future == null) {
                results[i] = deadlineResult(alert, classification, target, start);
                continue;
            }
            try {
                results[i] = future.get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException | CancellationException e) {
                future.cancel(true);
                results[i] = deadlineResult(alert, classification, target, start);
            } catch (ExecutionException e) {
                log.error("目标发布单元异常: target={}", target.getName(), e.getCause());
                results[i] = failure(target, PublishErrorCode.UNKNOWN_ERROR,
                        String.valueOf(e.getCause()), 0, System.currentTimeMillis() - start);
                record(results[i]);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                results[i] = deadlineResult(alert, classification, target, start);
            }
        }

        List<PublishResult> list = List.of(results);
        if (log.isDebugEnabled()) {
            long ok = list.stream().filter(PublishResult::isSuccess).count();
            log.debug("告警发布完成: fingerprint={}, 目标={}, 成功={}, 耗时={}ms",
                    alert.getFingerprint(), list.size(), ok, System.currentTimeMillis() - start);
        }
        return list;
    }

    /**
     * 向单个目标投递（含格式化与重试）
     *
     * @param deadLetterOnFailure 最终失败时是否写入死信队列，重放时为false
     */
    public PublishResult publishOne(Alert alert, Classification classification, Target target,
                                    Deadline deadline, boolean deadLetterOnFailure) {
        long start = System.currentTimeMillis();

        String payload;
        try {
            Map<String, Object> formatted = formatterRegistry.format(alert, classification, target);
            payload = JsonUtil.toJsonString(formatted);
            if (payload == null) {
                throw new IllegalStateException("载荷序列化失败");
            }
        } catch (RuntimeException e) {
            log.error("告警格式化失败: target={}, type={}, error={}", target.getName(), target.getType(), e.getMessage());
            PublishResult result = failure(target, PublishErrorCode.FORMAT_ERROR,
                    "格式化失败: " + e.getMessage(), 0, System.currentTimeMillis() - start);
            record(result);
            if (deadLetterOnFailure) {
                deadLetter(alert, classification, target, null, result);
            }
            return result;
        }

        long timeoutMillis = properties.getTargetTimeout().toMillis();
        AtomicReference<Integer> lastStatus = new AtomicReference<>(0);
        RetryResult<Integer> outcome = retryExecutor.execute(
                "publish:" + target.getName(),
                attempt -> {
                    try {
                        int status = sender.send(target, payload,
                                Duration.ofMillis(deadline.boundedMillis(timeoutMillis)));
                        lastStatus.set(status);
                        return status;
                    } catch (TargetDeliveryException e) {
                        lastStatus.set(e.getStatusCode());
                        throw e;
                    }
                },
                deadline);

        long duration = System.currentTimeMillis() - start;
        boolean cancelled = Thread.currentThread().isInterrupted();
        PublishResult result;
        if (outcome.success()) {
            result = PublishResult.builder()
                    .targetName(target.getName())
                    .targetType(target.getType())
                    .success(true)
                    .statusCode(outcome.value())
                    .retryCount(outcome.retryCount())
                    .durationMs(duration)
                    .build();
        } else {
            TargetDeliveryException error = outcome.error();
            result = PublishResult.builder()
                    .targetName(target.getName())
                    .targetType(target.getType())
                    .success(false)
                    .statusCode(lastStatus.get())
                    .errorCode(error.getErrorCode())
                    .errorMessage(outcome.deadlineExceeded()
                            ? error.getMessage() + "（截止时间前停止重试）" : error.getMessage())
                    .retryCount(outcome.retryCount())
                    .durationMs(duration)
                    .build();
        }
        if (cancelled) {
            // 已被汇总方按截止时间取消，结果与死信由汇总方记录
            return result;
        }
        if (!result.isSuccess()) {
            log.warn("目标投递失败: target={}, fingerprint={}, code={}, retries={}",
                    target.getName(), alert.getFingerprint(), result.getErrorCode(), outcome.retryCount());
            if (deadLetterOnFailure) {
                deadLetter(alert, classification, target, payload, result);
            }
        }
        record(result);
        return result;
    }

    public PublisherStats getStats() {
        Map<String, PublisherStats.TargetStats> targets = new TreeMap<>();
        targetCounters.forEach((name, counter) -> targets.put(name, counter.snapshot(name)));
        return PublisherStats.builder()
                .totalPublishes(totalPublishes.get())
                .successfulPublishes(successfulPublishes.get())
                .failedPublishes(failedPublishes.get())
                .totalRetries(totalRetries.get())
                .deadLettered(deadLettered.get())
                .deadlineExceeded(deadlineExceeded.get())
                .targets(targets)
                .build();
    }

    /**
     * 截止时间到达后不再发放许可，即使此刻恰好有空闲许可
     */
    private boolean acquire(Semaphore semaphore, Deadline deadline) {
        try {
            if (!semaphore.tryAcquire(deadline.remainingMillis(), TimeUnit.MILLISECONDS)) {
                return false;
            }
            if (deadline.isExpired()) {
                semaphore.release();
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private PublishResult deadlineResult(Alert alert, Classification classification, Target target, long start) {
        PublishResult result = PublishResult.deadlineExceeded(target, System.currentTimeMillis() - start);
        deadlineExceeded.incrementAndGet();
        record(result);
        log.warn("截止时间已到，目标发布被取消: target={}, fingerprint={}", target.getName(), alert.getFingerprint());
        deadLetter(alert, classification, target, null, result);
        return result;
    }

    private void deadLetter(Alert alert, Classification classification, Target target,
                            String payload, PublishResult result) {
        if (!properties.getDlq().isEnabled()) {
            return;
        }
        DeadLetterEntry entry = DeadLetterEntry.builder()
                .id(UUID.randomUUID().toString())
                .fingerprint(alert.getFingerprint())
                .targetName(target.getName())
                .targetType(target.getType())
                .alert(alert)
                .classification(classification)
                .payload(payload)
                .errorMessage(result.getErrorMessage())
                .errorCode(result.getErrorCode())
                .retryCount(result.getRetryCount())
                .failedAt(Instant.now())
                .build();
        try {
            deadLetterQueue.submit(entry);
            deadLettered.incrementAndGet();
        } catch (RuntimeException e) {
            log.error("写入死信队列失败: target={}, fingerprint={}", target.getName(), alert.getFingerprint(), e);
        }
    }

    private static PublishResult failure(Target target, PublishErrorCode code, String message,
                                         int retries, long duration) {
        return PublishResult.builder()
                .targetName(target.getName())
                .targetType(target.getType())
                .success(false)
                .errorCode(code)
                .errorMessage(message)
                .retryCount(retries)
                .durationMs(duration)
                .build();
    }

    private void record(PublishResult result) {
        totalPublishes.incrementAndGet();
        totalRetries.addAndGet(result.getRetryCount());
        if (result.isSuccess()) {
            successfulPublishes.incrementAndGet();
        } else {
            failedPublishes.incrementAndGet();
        }
        targetCounters.computeIfAbsent(result.getTargetName(), k -> new TargetCounter()).record(result);
    }

    private static class TargetCounter {
        private final AtomicLong attempts = new AtomicLong(0);
        private final AtomicLong successes = new AtomicLong(0);
        private final AtomicLong failures = new AtomicLong(0);
        private final AtomicLong retries = new AtomicLong(0);
        private final AtomicLong totalDuration = new AtomicLong(0);
        private volatile String lastError;
        private volatile Instant lastSuccessTime;
        private volatile Instant lastFailureTime;

        void record(PublishResult result) {
            attempts.incrementAndGet();
            retries.addAndGet(result.getRetryCount());
            totalDuration.addAndGet(result.getDurationMs());
            if (result.isSuccess()) {
                successes.incrementAndGet();
                lastSuccessTime = Instant.now();
            } else {
                failures.incrementAndGet();
                lastError = result.getErrorMessage();
                lastFailureTime = Instant.now();
            }
        }

        PublisherStats.TargetStats snapshot(String name) {
            long count = attempts.get();
            return PublisherStats.TargetStats.builder()
                    .targetName(name)
                    .attempts(count)
                    .successes(successes.get())
                    .failures(failures.get())
                    .retries(retries.get())
                    .averageDurationMs(count > 0 ? totalDuration.get() / count : 0)
                    .lastError(lastError)
                    .lastSuccessTime(lastSuccessTime)
                    .lastFailureTime(lastFailureTime)
                    .build();
        }
    }
}
