package com.wangbin.alerting.core.publish.dlq;

import com.wangbin.alerting.common.domain.entity.PublishResult;
import com.wangbin.alerting.common.domain.entity.Target;
import com.wangbin.alerting.common.exception.ConflictException;
import com.wangbin.alerting.common.exception.NotFoundException;
import com.wangbin.alerting.common.utils.Deadline;
import com.wangbin.alerting.common.web.result.ResultCode;
import com.wangbin.alerting.core.publish.ParallelPublisher;
import com.wangbin.alerting.core.publish.config.PublishingProperties;
import com.wangbin.alerting.core.target.TargetRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 死信查询、重放与过期清理
 */
@Slf4j
@Service
public class DeadLetterService {

    private static final int MAX_LIST_LIMIT = 1000;

    private final DeadLetterQueue queue;
    private final ParallelPublisher publisher;
    private final TargetRegistry targetRegistry;
    private final PublishingProperties properties;

    public DeadLetterService(DeadLetterQueue queue, ParallelPublisher publisher,
                             TargetRegistry targetRegistry, PublishingProperties properties) {
        this.queue = queue;
        this.publisher = publisher;
        this.targetRegistry = targetRegistry;
        this.properties = properties;
    }

    public List<DeadLetterEntry> list(String targetName, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return queue.list(targetName, bounded);
    }

    public DeadLetterEntry get(String id) {
        return queue.get(id).orElseThrow(() ->
                new NotFoundException(ResultCode.DEAD_LETTER_NOT_FOUND, "死信记录不存在: " + id));
    }

    /**
     * 按记录的目标重新发布，成功后移除记录
     *
     * 载荷按目标当前配置重新格式化；失败时不会再次写入死信队列，只更新重放次数。
     * 目标已停用时拒绝重放，记录保持不变。
     */
    public PublishResult replay(String id) {
        DeadLetterEntry entry = get(id);
        Target target = targetRegistry.find(entry.getTargetName()).orElseThrow(() ->
                new NotFoundException(ResultCode.TARGET_NOT_FOUND, "发布目标不存在: " + entry.getTargetName()));
        if (!target.isEnabled()) {
            throw new ConflictException(ResultCode.TARGET_DISABLED,
                    "发布目标已停用，不能重放: " + target.getName());
        }

        PublishResult result = publisher.publishOne(entry.getAlert(), entry.getClassification(),
                target, replayDeadline(), false);

        if (result.isSuccess()) {
            queue.remove(id);
            log.info("死信重放成功: id={}, target={}, fingerprint={}", id, target.getName(), entry.getFingerprint());
        } else {
            queue.update(entry.toBuilder()
                    .replayCount(entry.getReplayCount() + 1)
                    .lastReplayAt(Instant.now())
                    .errorCode(result.getErrorCode())
                    .errorMessage(result.getErrorMessage())
                    .build());
            log.warn("死信重放失败: id={}, target={}, error={}", id, target.getName(), result.getErrorMessage());
        }
        return result;
    }

    public boolean remove(String id) {
        return queue.remove(id);
    }

    public int clear() {
        int cleared = queue.clear();
        log.info("死信队列已清空: {}条", cleared);
        return cleared;
    }

    public DeadLetterStats getStats() {
        return queue.getStats();
    }

    @Scheduled(fixedDelayString = "${alerting.publishing.dlq.purge-interval-ms:3600000}",
            initialDelayString = "${alerting.publishing.dlq.purge-interval-ms:3600000}")
    public int purgeExpired() {
        Instant cutoff = Instant.now().minus(properties.getDlq().getRetention());
        int purged = queue.purgeOlderThan(cutoff);
        if (purged > 0) {
            log.info("清理过期死信: {}条, 截止={}", purged, cutoff);
        }
        return purged;
    }

    private Deadline replayDeadline() {
        Duration perAttempt = properties.getTargetTimeout();
        int attempts = properties.getRetry().getMaxRetries() + 1;
        Duration backoff = properties.getRetry().getBackoff().stream().reduce(Duration.ZERO, Duration::plus);
        return Deadline.after(perAttempt.multipliedBy(attempts).plus(backoff));
    }
}
