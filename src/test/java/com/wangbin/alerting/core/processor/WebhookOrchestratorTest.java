package com.wangbin.alerting.core.processor;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.PublishResult;
import com.wangbin.alerting.common.domain.entity.Target;
import com.wangbin.alerting.common.domain.enums.AlertOutcome;
import com.wangbin.alerting.common.domain.enums.BatchStatus;
import com.wangbin.alerting.common.domain.enums.ClassificationSource;
import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import com.wangbin.alerting.common.domain.enums.PublishingMode;
import com.wangbin.alerting.common.domain.enums.Severity;
import com.wangbin.alerting.core.cache.config.CacheProperties;
import com.wangbin.alerting.core.cache.manager.LocalCacheManager;
import com.wangbin.alerting.core.cache.manager.MultiLevelCacheManager;
import com.wangbin.alerting.core.classifier.ClassificationService;
import com.wangbin.alerting.core.classifier.FallbackClassifier;
import com.wangbin.alerting.core.classifier.config.ClassificationProperties;
import com.wangbin.alerting.core.classifier.provider.ClassificationProvider;
import com.wangbin.alerting.core.classifier.provider.ClassificationProviderException;
import com.wangbin.alerting.core.filter.FilterEngine;
import com.wangbin.alerting.core.filter.rule.SeverityRule;
import com.wangbin.alerting.core.mode.ModeManager;
import com.wangbin.alerting.core.mode.ModeSnapshot;
import com.wangbin.alerting.core.processor.config.WebhookProperties;
import com.wangbin.alerting.core.publish.ParallelPublisher;
import com.wangbin.alerting.core.publish.config.PublishingProperties;
import com.wangbin.alerting.core.publish.dlq.InMemoryDeadLetterQueue;
import com.wangbin.alerting.core.publish.formatter.FormatterRegistry;
import com.wangbin.alerting.core.publish.formatter.SlackFormatter;
import com.wangbin.alerting.core.publish.formatter.WebhookFormatter;
import com.wangbin.alerting.core.publish.retry.RetryExecutor;
import com.wangbin.alerting.core.publish.retry.RetryPolicy;
import com.wangbin.alerting.core.storage.InMemoryAlertStorage;
import com.wangbin.alerting.core.target.TargetRegistry;
import com.wangbin.alerting.support.ScriptedSender;
import com.wangbin.alerting.support.TestAlerts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebhookOrchestratorTest {

    private final ScriptedSender sender = new ScriptedSender();
    private final InMemoryAlertStorage storage = new InMemoryAlertStorage(100);
    private final SeverityProvider provider = new SeverityProvider();

    private MultiLevelCacheManager cacheManager;
    private ExecutorService workers;
    private ExecutorService storageExecutor;
    private FilterEngine filterEngine;
    private WebhookProperties webhook;
    private ExecutorService alertExecutor;
    private Function<TargetRegistry, ModeManager> modeManagerFactory;

    @BeforeEach
    void setUp() {
        cacheManager = new MultiLevelCacheManager(List.of(new LocalCacheManager(new CacheProperties())));
        cacheManager.init();
        workers = Executors.newCachedThreadPool();
        storageExecutor = Executors.newSingleThreadExecutor();
        filterEngine = new FilterEngine(List.of(), true, Clock.systemUTC());
        webhook = new WebhookProperties();
        webhook.setRequestTimeout(Duration.ofSeconds(5));
        alertExecutor = workers;
        modeManagerFactory = registry -> new ModeManager(registry, 10, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        storageExecutor.shutdownNow();
        cacheManager.destroy();
    }

    private WebhookOrchestrator orchestrator(List<Target> targets) {
        ClassificationProperties classification = new ClassificationProperties();
        classification.setTimeout(Duration.ofMillis(300));
        ClassificationService classifier = new ClassificationService(classification, cacheManager, provider,
                new FallbackClassifier(classification), workers);

        PublishingProperties publishing = new PublishingProperties();
        RetryExecutor retry = new RetryExecutor(RetryPolicy.from(publishing.getRetry()), millis -> { });
        ParallelPublisher publisher = new ParallelPublisher(publishing,
                new FormatterRegistry(List.of(new WebhookFormatter(), new SlackFormatter())),
                sender, new InMemoryDeadLetterQueue(100), workers, retry);

        TargetRegistry registry = new TargetRegistry(() -> targets);
        return new WebhookOrchestrator(webhook, classifier, filterEngine, publisher, registry,
                modeManagerFactory.apply(registry), storage, alertExecutor, storageExecutor);
    }

    @Test
    void criticalAlertIsClassifiedAndPublishedToAllTargets() {
        WebhookOrchestrator orchestrator = orchestrator(List.of(TestAlerts.target("hook"),
                TestAlerts.target("chat", "slack")));

        WebhookProcessingResult result = orchestrator.processWebhook("am",
                List.of(TestAlerts.alert("NodeDown", "critical")));

        assertEquals(BatchStatus.SUCCESS, result.getStatus());
        AlertProcessingResult alert = result.getAlertResults().get(0);
        assertEquals(AlertOutcome.PROCESSED, alert.getOutcome());
        assertEquals(ClassificationSource.PROVIDER, alert.getClassification().getSource());
        assertEquals(Severity.CRITICAL, alert.getClassification().getSeverity());
        assertEquals(2, alert.getPublishResults().size());
        assertTrue(alert.getPublishResults().stream().allMatch(PublishResult::isSuccess));

        assertEquals(1, result.getSummary().getReceived());
        assertEquals(1, result.getSummary().getPublished());
        assertEquals(2, result.getPublishingSummary().getSuccessfulPublishes());
        assertEquals(PublishingMode.NORMAL, result.getPublishingSummary().getMode());
    }

    @Test
    void deniedAlertIsFilteredAndNotPublished() {
        filterEngine = new FilterEngine(List.of(new SeverityRule("drop-info", EnumSet.noneOf(Severity.class),
                EnumSet.of(Severity.INFO))), true, Clock.systemUTC());
        WebhookOrchestrator orchestrator = orchestrator(List.of(TestAlerts.target("hook")));

        WebhookProcessingResult result = orchestrator.processWebhook("am",
                List.of(TestAlerts.alert("Heartbeat", "info")));

        AlertProcessingResult alert = result.getAlertResults().get(0);
        assertEquals(AlertOutcome.FILTERED, alert.getOutcome());
        assertEquals("drop-info", alert.getFilterDecision().getRuleName());
        assertTrue(alert.getPublishResults().isEmpty());
        assertEquals(0, sender.calls("hook"));
        assertEquals(BatchStatus.PARTIAL, result.getStatus());
        assertEquals(1, result.getSummary().getFiltered());
        assertEquals(1, result.getSummary().getProcessed());
    }

    @Test
    void slowProviderFallsBackToRuleClassification() {
        provider.delayMillis = 2000;
        WebhookOrchestrator orchestrator = orchestrator(List.of(TestAlerts.target("hook")));

        WebhookProcessingResult result = orchestrator.processWebhook("am",
                List.of(TestAlerts.alert("NodeDown", "critical")));

        Classification classification = result.getAlertResults().get(0).getClassification();
        assertEquals(ClassificationSource.FALLBACK, classification.getSource());
        assertEquals(0.6, classification.getConfidence(), 1e-9);
        assertEquals(BatchStatus.SUCCESS, result.getStatus());
    }

    @Test
    void noTargetsMeansMetricsOnlyProcessing() {
        WebhookOrchestrator orchestrator = orchestrator(List.of());

        WebhookProcessingResult result = orchestrator.processWebhook("am",
                List.of(TestAlerts.alert("NodeDown", "critical"), TestAlerts.alert("DiskFull", "warning")));

        assertEquals(BatchStatus.SUCCESS, result.getStatus());
        assertEquals(PublishingMode.METRICS_ONLY, result.getPublishingSummary().getMode());
        assertEquals(0, result.getPublishingSummary().getTotalTargets());
        assertEquals(2, result.getSummary().getProcessed());
        assertEquals(0, result.getSummary().getPublished());
        result.getAlertResults().forEach(r -> assertEquals(AlertOutcome.PROCESSED, r.getOutcome()));
    }

    @Test
    void allTargetsFailingFailsTheBatch() {
        sender.respond("a", 500).respond("b", 503);
        WebhookOrchestrator orchestrator = orchestrator(List.of(TestAlerts.target("a"), TestAlerts.target("b")));

        WebhookProcessingResult result = orchestrator.processWebhook("am",
                List.of(TestAlerts.alert("NodeDown", "critical")));

        assertEquals(BatchStatus.FAILED, result.getStatus());
        assertEquals(AlertOutcome.FAILED, result.getAlertResults().get(0).getOutcome());
        assertEquals(1, result.getSummary().getFailed());
        assertEquals(2, result.getPublishingSummary().getFailedPublishes());
    }

    @Test
    void oneFailingTargetGivesPartialOutcome() {
        sender.respond("b", 500);
        WebhookOrchestrator orchestrator = orchestrator(List.of(TestAlerts.target("a"), TestAlerts.target("b")));

        WebhookProcessingResult result = orchestrator.processWebhook("am",
                List.of(TestAlerts.alert("NodeDown", "critical")));

        assertEquals(AlertOutcome.PARTIAL, result.getAlertResults().get(0).getOutcome());
        assertEquals(BatchStatus.PARTIAL, result.getStatus());
        assertEquals(1, result.getSummary().getPublished());
    }

    @Test
    void resultsKeepRequestOrder() throws InterruptedException {
        WebhookOrchestrator orchestrator = orchestrator(List.of(TestAlerts.target("hook")));
        List<Alert> alerts = List.of(TestAlerts.alert("A", "critical"), TestAlerts.alert("B", "warning"),
                TestAlerts.alert("C", "info"));

        WebhookProcessingResult result = orchestrator.processWebhook("am", alerts);

        for (int i = 0; i < alerts.size(); i++) {
            AlertProcessingResult r = result.getAlertResults().get(i);
            assertEquals(i, r.getIndex());
            assertEquals(alerts.get(i).getFingerprint(), r.getFingerprint());
        }

        storageExecutor.shutdown();
        assertTrue(storageExecutor.awaitTermination(1, TimeUnit.SECONDS));
        assertEquals(3, storage.size());
    }

    @Test
    void deadlineReachedMidBatchFailsUnstartedAlerts() {
        webhook.setRequestTimeout(Duration.ofMillis(300));
        webhook.setMaxConcurrency(1);
        sender.delay("hook", 3000);
        WebhookOrchestrator orchestrator = orchestrator(List.of(TestAlerts.target("hook")));

        long start = System.nanoTime();
        WebhookProcessingResult result = orchestrator.processWebhook("am", List.of(
                TestAlerts.alert("A", "critical"), TestAlerts.alert("B", "critical"), TestAlerts.alert("C", "critical")));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMillis < 1500, "耗时 " + elapsedMillis + "ms");
        assertEquals(3, result.getAlertResults().size());
        AlertProcessingResult first = result.getAlertResults().get(0);
        assertEquals(AlertOutcome.FAILED, first.getOutcome());
        assertEquals(PublishErrorCode.DEADLINE_EXCEEDED, first.getPublishResults().get(0).getErrorCode());
        for (int i = 1; i < 3; i++) {
            AlertProcessingResult later = result.getAlertResults().get(i);
            assertEquals(i, later.getIndex());
            assertEquals(AlertOutcome.FAILED, later.getOutcome());
            assertTrue(later.getError().contains("截止时间"), later.getError());
        }
        assertEquals(1, sender.calls("hook"), "截止时间后不再启动新的告警");
        assertEquals(BatchStatus.FAILED, result.getStatus());
        assertEquals(3, result.getSummary().getFailed());
    }

    @Test
    void unexpectedOrchestrationErrorFailsEveryAlert() {
        ModeManager modeManager = mock(ModeManager.class);
        when(modeManager.getModeMetrics())
                .thenThrow(new IllegalStateException("mode snapshot unavailable"))
                .thenReturn(ModeSnapshot.builder().mode(PublishingMode.NORMAL).enabledTargets(1).build());
        modeManagerFactory = registry -> modeManager;
        WebhookOrchestrator orchestrator = orchestrator(List.of(TestAlerts.target("hook")));

        WebhookProcessingResult result = orchestrator.processWebhook("am",
                List.of(TestAlerts.alert("NodeDown", "critical"), TestAlerts.alert("DiskFull", "warning")));

        assertEquals(BatchStatus.FAILED, result.getStatus());
        assertEquals(2, result.getAlertResults().size());
        for (int i = 0; i < 2; i++) {
            AlertProcessingResult r = result.getAlertResults().get(i);
            assertEquals(i, r.getIndex());
            assertEquals(AlertOutcome.FAILED, r.getOutcome());
            assertTrue(r.getError().contains("mode snapshot unavailable"), r.getError());
        }
        assertEquals(2, result.getSummary().getFailed());
        assertEquals(PublishingMode.NORMAL, result.getPublishingSummary().getMode());
    }

    @Test
    void executorFailureFailsEveryAlert() {
        alertExecutor = new AbstractExecutorService() {
            @Override
            public void execute(Runnable command) {
                throw new IllegalStateException("executor closed");
            }

            @Override
            public void shutdown() {
            }

            @Override
            public List<Runnable> shutdownNow() {
                return List.of();
            }

            @Override
            public boolean isShutdown() {
                return true;
            }

            @Override
            public boolean isTerminated() {
                return true;
            }

            @Override
            public boolean awaitTermination(long timeout, TimeUnit unit) {
                return true;
            }
        };
        WebhookOrchestrator orchestrator = orchestrator(List.of(TestAlerts.target("hook")));

        WebhookProcessingResult result = orchestrator.processWebhook("am",
                List.of(TestAlerts.alert("NodeDown", "critical"), TestAlerts.alert("DiskFull", "warning")));

        assertEquals(BatchStatus.FAILED, result.getStatus());
        result.getAlertResults().forEach(r -> assertEquals(AlertOutcome.FAILED, r.getOutcome()));
        assertEquals(0, sender.calls("hook"));
    }

    @Test
    void batchStatusRules() {
        assertEquals(BatchStatus.SUCCESS, WebhookOrchestrator.batchStatus(List.of()));
        assertEquals(BatchStatus.FAILED, WebhookOrchestrator.batchStatus(List.of(result(AlertOutcome.FAILED))));
        assertEquals(BatchStatus.PARTIAL, WebhookOrchestrator.batchStatus(
                List.of(result(AlertOutcome.PROCESSED), result(AlertOutcome.FAILED))));
        assertEquals(BatchStatus.SUCCESS, WebhookOrchestrator.batchStatus(
                List.of(result(AlertOutcome.PROCESSED), result(AlertOutcome.PROCESSED))));
    }

    private static AlertProcessingResult result(AlertOutcome outcome) {
        return AlertProcessingResult.builder().outcome(outcome).build();
    }

    private static class SeverityProvider implements ClassificationProvider {
        volatile long delayMillis;

        @Override
        public Classification classify(Alert alert, Duration timeout) throws ClassificationProviderException {
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ClassificationProviderException("interrupted");
                }
            }
            return TestAlerts.classification(Severity.fromCode(alert.label("severity")));
        }

        @Override
        public String getName() {
            return "severity";
        }
    }
}
