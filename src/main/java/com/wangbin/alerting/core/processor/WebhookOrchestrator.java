package com.wangbin.alerting.core.processor;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.FilterDecision;
import com.wangbin.alerting.common.domain.entity.PublishResult;
import com.wangbin.alerting.common.domain.entity.Target;
import com.wangbin.alerting.common.domain.enums.AlertOutcome;
import com.wangbin.alerting.common.domain.enums.BatchStatus;
import com.wangbin.alerting.common.utils.Deadline;
import com.wangbin.alerting.core.classifier.ClassificationService;
import com.wangbin.alerting.core.filter.FilterEngine;
import com.wangbin.alerting.core.mode.ModeManager;
import com.wangbin.alerting.core.mode.ModeSnapshot;
import com.wangbin.alerting.core.processor.config.WebhookProperties;
import com.wangbin.alerting.core.publish.ParallelPublisher;
import com.wangbin.alerting.core.storage.AlertStorage;
import com.wangbin.alerting.core.target.TargetRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Webhook批次编排
 *
 * 每条告警依次经过 存储(异步) -> 分类 -> 过滤 -> 发布。
 * 批次内并发受信号量限制，结果按下标组装。单条告警失败不影响其它告警，
 * 截止时间到达时未完成的告警被取消，已完成的结果照常返回。
 */
@Slf4j
@Service
public class WebhookOrchestrator {

    /** 截止时间后等待内部阶段自行返回超时结果的宽限 */
    private static final long COMPLETION_GRACE_MS = 100;

    private final WebhookProperties properties;
    private final ClassificationService classificationService;
    private final FilterEngine filterEngine;
    private final ParallelPublisher publisher;
    private final TargetRegistry targetRegistry;
    private final ModeManager modeManager;
    private final AlertStorage alertStorage;
    private final ExecutorService alertExecutor;
    private final ExecutorService storageExecutor;

    public WebhookOrchestrator(WebhookProperties properties,
                               ClassificationService classificationService,
                               FilterEngine filterEngine,
                               ParallelPublisher publisher,
                               TargetRegistry targetRegistry,
                               ModeManager modeManager,
                               AlertStorage alertStorage,
                               @Qualifier("alertProcessingExecutor") ExecutorService alertExecutor,
                               @Qualifier("storageExecutor") ExecutorService storageExecutor) {
        this.properties = properties;
        this.classificationService = classificationService;
        this.filterEngine = filterEngine;
        this.publisher = publisher;
        this.targetRegistry = targetRegistry;
        this.modeManager = modeManager;
        this.alertStorage = alertStorage;
        this.alertExecutor = alertExecutor;
        this.storageExecutor = storageExecutor;
    }

    /**
     * 处理一个已校验的告警批次，始终返回结构化结果
     */
    public WebhookProcessingResult processWebhook(String receiver, List<Alert> alerts) {
        long start = System.currentTimeMillis();
        Deadline deadline = Deadline.after(properties.getRequestTimeout());
        try {
            List<AlertProcessingResult> results = processAll(alerts, deadline);
            return aggregate(receiver, results, start);
        } catch (RuntimeException e) {
            log.error("批次编排异常，整体按失败处理: receiver={}, alerts={}", receiver, alerts.size(), e);
            List<AlertProcessingResult> failed = new ArrayList<>(alerts.size());
            for (int i = 0; i < alerts.size(); i++) {
                failed.add(failedResult(i, alerts.get(i), "编排异常: " + e.getMessage(), 0));
            }
            return aggregate(receiver, failed, start);
        }
    }

    private List<AlertProcessingResult> processAll(List<Alert> alerts, Deadline deadline) {
        int size = alerts.size();
        Semaphore semaphore = new Semaphore(Math.max(1, properties.getMaxConcurrency()));
        AlertProcessingResult[] results = new AlertProcessingResult[size];
        List<Future<AlertProcessingResult>> futures = new ArrayList<>(size);

        for (int i = 0; i < size; i++) {
            int index = i;
            Alert alert = alerts.get(i);
            if (!acquire(semaphore, deadline)) {
                futures.add(null);
                continue;
            }
            try {
                futures.add(alertExecutor.submit(() -> {
                    try {
                        return processAlert(index, alert, deadline);
                    } finally {
                        semaphore.release();
                    }
                }));
            } catch (RejectedExecutionException e) {
                semaphore.release();
                log.error("告警处理线程池已满: fingerprint={}", alert.getFingerprint());
                results[i] = failedResult(i, alert, "处理线程池已满", 0);
                futures.add(null);
            }
        }

        for (int i = 0; i < size; i++) {
            if (results[i] != null) {
                continue;
            }
            Alert alert = alerts.get(i);
            Future<AlertProcessingResult> future = futures.get(i);
            if (future == null) {
                results[i] = failedResult(i, alert, "请求截止时间已到，告警未开始处理", 0);
                continue;
            }
            try {
                results[i] = future.get(deadline.remainingMillis() + COMPLETION_GRACE_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException | CancellationException e) {
                future.cancel(true);
                log.warn("告警处理超过截止时间被取消: fingerprint={}", alert.getFingerprint());
                results[i] = failedResult(i, alert, "请求截止时间已到，告警处理被取消", 0);
            } catch (ExecutionException e) {
                log.error("告警处理异常: fingerprint={}", alert.getFingerprint(), e.getCause());
                results[i] = failedResult(i, alert, "处理异常: " + e.getCause(), 0);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                results[i] = failedResult(i, alert, "处理被中断", 0);
            }
        }
        return List.of(results);
    }

    AlertProcessingResult processAlert(int index, Alert alert, Deadline deadline) {
        long start = System.currentTimeMillis();
        storeAsync(alert);

        Classification classification = null;
        try {
            classification = classificationService.classify(alert, deadline);
            FilterDecision decision = filterEngine.evaluate(alert, classification);

            AlertProcessingResult.AlertProcessingResultBuilder builder = AlertProcessingResult.builder()
                    .index(index)
                    .fingerprint(alert.getFingerprint())
                    .alertName(alert.alertName())
                    .alertStatus(alert.getStatus())
                    .classification(classification)
                    .filterDecision(decision);

            if (!decision.isAllowed()) {
                log.debug("告警被过滤: fingerprint={}, rule={}, reason={}",
                        alert.getFingerprint(), decision.getRuleName(), decision.getReason());
                return builder.outcome(AlertOutcome.FILTERED)
                        .processingTimeMs(System.currentTimeMillis() - start)
                        .build();
            }

            List<Target> targets = targetRegistry.enabledTargets();
            if (targets.isEmpty()) {
                log.debug("无可用目标(指标模式)，告警不发布: fingerprint={}", alert.getFingerprint());
            }
            List<PublishResult> publishResults = publisher.publishToTargets(alert, classification, targets, deadline);

            return builder.outcome(outcomeOf(publishResults))
                    .publishResults(publishResults)
                    .processingTimeMs(System.currentTimeMillis() - start)
                    .build();
        } catch (RuntimeException e) {
            log.error("告警处理失败: fingerprint={}", alert.getFingerprint(), e);
            return AlertProcessingResult.builder()
                    .index(index)
                    .fingerprint(alert.getFingerprint())
                    .alertName(alert.alertName())
                    .alertStatus(alert.getStatus())
                    .outcome(AlertOutcome.FAILED)
                    .classification(classification)
                    .error(e.getMessage())
                    .processingTimeMs(System.currentTimeMillis() - start)
                    .build();
        }
    }

    private void storeAsync(Alert alert) {
        try {
            storageExecutor.execute(() -> {
                try {
                    alertStorage.store(alert);
                } catch (RuntimeException e) {
                    log.warn("告警存储失败: fingerprint={}, error={}", alert.getFingerprint(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("存储线程池拒绝任务: fingerprint={}", alert.getFingerprint());
        }
    }

    static AlertOutcome outcomeOf(List<PublishResult> publishResults) {
        if (publishResults.isEmpty()) {
            return AlertOutcome.PROCESSED;
        }
        long succeeded = publishResults.stream().filter(PublishResult::isSuccess).count();
        if (succeeded == publishResults.size()) {
            return AlertOutcome.PROCESSED;
        }
        return succeeded > 0 ? AlertOutcome.PARTIAL : AlertOutcome.FAILED;
    }

    private WebhookProcessingResult aggregate(String receiver, List<AlertProcessingResult> results, long start) {
        int processed = 0;
        int classified = 0;
        int filtered = 0;
        int published = 0;
        int failed = 0;
        int totalTargets = 0;
        int successfulPublishes = 0;

        for (AlertProcessingResult result : results) {
            if (result.getClassification() != null) {
                classified++;
            }
            switch (result.getOutcome()) {
                case PROCESSED:
                case PARTIAL:
                    processed++;
                    break;
                case FILTERED:
                    processed++;
                    filtered++;
                    break;
                default:
                    failed++;
                    break;
            }
            if (result.successfulPublishes() > 0) {
                published++;
            }
            totalTargets += result.getPublishResults().size();
            successfulPublishes += (int) result.successfulPublishes();
        }

        BatchStatus status = batchStatus(results);
        ModeSnapshot mode = modeManager.getModeMetrics();

        WebhookProcessingResult.Summary summary = WebhookProcessingResult.Summary.builder()
                .received(results.size())
                .processed(processed)
                .classified(classified)
                .filtered(filtered)
                .published(published)
                .failed(failed)
                .build();

        WebhookProcessingResult.PublishingSummary publishingSummary = WebhookProcessingResult.PublishingSummary.builder()
                .totalTargets(totalTargets)
                .successfulPublishes(successfulPublishes)
                .failedPublishes(totalTargets - successfulPublishes)
                .mode(mode.getMode())
                .enabledTargets(mode.getEnabledTargets())
                .build();

        long elapsed = System.currentTimeMillis() - start;
        log.info("Webhook处理完成: receiver={}, status={}, 收到={}, 过滤={}, 失败={}, 目标发布={}/{}, 耗时={}ms",
                receiver, status.getCode(), results.size(), filtered, failed,
                successfulPublishes, totalTargets, elapsed);

        return WebhookProcessingResult.builder()
                .status(status)
                .message(message(status, summary, publishingSummary))
                .receiver(receiver)
                .alertResults(results)
                .summary(summary)
                .publishingSummary(publishingSummary)
                .processingTimeMs(elapsed)
                .build();
    }

    /**
     * 全部失败为FAILED，全部PROCESSED为SUCCESS，其余为PARTIAL
     */
    static BatchStatus batchStatus(List<AlertProcessingResult> results) {
        if (results.isEmpty()) {
            return BatchStatus.SUCCESS;
        }
        boolean allFailed = true;
        boolean allProcessed = true;
        for (AlertProcessingResult result : results) {
            if (result.getOutcome() != AlertOutcome.FAILED) {
                allFailed = false;
            }
            if (result.getOutcome() != AlertOutcome.PROCESSED) {
                allProcessed = false;
            }
        }
        if (allFailed) {
            return BatchStatus.FAILED;
        }
        return allProcessed ? BatchStatus.SUCCESS : BatchStatus.PARTIAL;
    }

    private static String message(BatchStatus status, WebhookProcessingResult.Summary summary,
                                  WebhookProcessingResult.PublishingSummary publishing) {
        switch (status) {
            case SUCCESS:
                return "全部告警处理成功";
            case FAILED:
                return "全部告警处理失败";
            default:
                return String.format("%d/%d 条告警被过滤，%d 条失败，%d/%d 个目标发布失败",
                        summary.getFiltered(), summary.getReceived(), summary.getFailed(),
                        publishing.getFailedPublishes(), publishing.getTotalTargets());
        }
    }

    private static AlertProcessingResult failedResult(int index, Alert alert, String error, long elapsed) {
        return AlertProcessingResult.builder()
                .index(index)
                .fingerprint(alert.getFingerprint())
                .alertName(alert.alertName())
                .alertStatus(alert.getStatus())
                .outcome(AlertOutcome.FAILED)
                .error(error)
                .processingTimeMs(elapsed)
                .build();
    }

    /**
     * 截止时间到达后不再发放许可，即使此刻恰好有空闲许可
     */
    private static boolean acquire(Semaphore semaphore, Deadline deadline) {
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
}
