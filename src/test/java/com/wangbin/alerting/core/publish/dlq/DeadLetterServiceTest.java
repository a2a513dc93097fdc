package com.wangbin.alerting.core.publish.dlq;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.PublishResult;
import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import com.wangbin.alerting.common.domain.enums.Severity;
import com.wangbin.alerting.common.exception.ConflictException;
import com.wangbin.alerting.common.exception.NotFoundException;
import com.wangbin.alerting.common.utils.Deadline;
import com.wangbin.alerting.common.web.result.ResultCode;
import com.wangbin.alerting.core.publish.ParallelPublisher;
import com.wangbin.alerting.core.publish.config.PublishingProperties;
import com.wangbin.alerting.core.publish.formatter.FormatterRegistry;
import com.wangbin.alerting.core.publish.formatter.WebhookFormatter;
import com.wangbin.alerting.core.publish.retry.RetryExecutor;
import com.wangbin.alerting.core.publish.retry.RetryPolicy;
import com.wangbin.alerting.core.target.TargetRegistry;
import com.wangbin.alerting.support.ScriptedSender;
import com.wangbin.alerting.support.TestAlerts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class DeadLetterServiceTest {

    private final PublishingProperties properties = new PublishingProperties();
    private final ScriptedSender sender = new ScriptedSender();
    private final InMemoryDeadLetterQueue queue = new InMemoryDeadLetterQueue(100);
    private final Alert alert = TestAlerts.alert("DiskFull", "warning");

    private ExecutorService executor;
    private ParallelPublisher publisher;
    private DeadLetterService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        RetryExecutor retry = new RetryExecutor(RetryPolicy.from(properties.getRetry()), millis -> { });
        publisher = new ParallelPublisher(properties, new FormatterRegistry(List.of(new WebhookFormatter())),
                sender, queue, executor, retry);
        TargetRegistry registry = new TargetRegistry(() -> List.of(TestAlerts.target("ops"),
                TestAlerts.target("paused").toBuilder().enabled(false).build()));
        service = new DeadLetterService(queue, publisher, registry, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private DeadLetterEntry failOnce() {
        sender.respond("ops", 503);
        publisher.publishToTargets(alert, TestAlerts.classification(Severity.WARNING),
                List.of(TestAlerts.target("ops")), Deadline.after(Duration.ofSeconds(10)));
        return queue.list("ops", 1).get(0);
    }

    @Test
    void successfulReplayRemovesEntry() {
        DeadLetterEntry entry = failOnce();
        sender.respond("ops", 200);

        PublishResult result = service.replay(entry.getId());

        assertTrue(result.isSuccess());
        assertEquals(0, queue.size());
    }

    @Test
    void failedReplayIsRecordedWithoutNewEntry() {
        DeadLetterEntry entry = failOnce();
        sender.respond("ops", 500);

        PublishResult result = service.replay(entry.getId());

        assertFalse(result.isSuccess());
        assertEquals(1, queue.size());
        DeadLetterEntry updated = service.get(entry.getId());
        assertEquals(1, updated.getReplayCount());
        assertNotNull(updated.getLastReplayAt());
        assertEquals(PublishErrorCode.SERVER_ERROR, updated.getErrorCode());
    }

    @Test
    void unknownEntryIsNotFound() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> service.replay("missing"));
        assertEquals(ResultCode.DEAD_LETTER_NOT_FOUND.getCode(), e.getCode());
    }

    @Test
    void replayFailsWhenTargetWasRemoved() {
        queue.submit(DeadLetterEntry.builder()
                .id("orphan")
                .fingerprint(alert.getFingerprint())
                .targetName("gone")
                .targetType("webhook")
                .alert(alert)
                .classification(TestAlerts.classification(Severity.WARNING))
                .failedAt(Instant.now())
                .build());

        NotFoundException e = assertThrows(NotFoundException.class, () -> service.replay("orphan"));
        assertEquals(ResultCode.TARGET_NOT_FOUND.getCode(), e.getCode());
        assertEquals(1, queue.size());
    }

    @Test
    void replayToDisabledTargetIsRejected() {
        queue.submit(DeadLetterEntry.builder()
                .id("paused-1")
                .fingerprint(alert.getFingerprint())
                .targetName("paused")
                .targetType("webhook")
                .alert(alert)
                .classification(TestAlerts.classification(Severity.WARNING))
                .failedAt(Instant.now())
                .build());

        ConflictException e = assertThrows(ConflictException.class, () -> service.replay("paused-1"));

        assertEquals(ResultCode.TARGET_DISABLED.getCode(), e.getCode());
        assertEquals(0, sender.calls("paused"));
        DeadLetterEntry kept = service.get("paused-1");
        assertEquals(0, kept.getReplayCount());
        assertNull(kept.getLastReplayAt());
    }

    @Test
    void purgeRemovesEntriesPastRetention() {
        properties.getDlq().setRetention(Duration.ofHours(1));
        queue.submit(DeadLetterEntry.builder().id("old").targetName("ops").alert(alert)
                .failedAt(Instant.now().minus(Duration.ofHours(2))).build());
        queue.submit(DeadLetterEntry.builder().id("new").targetName("ops").alert(alert)
                .failedAt(Instant.now()).build());

        assertEquals(1, service.purgeExpired());
        assertTrue(queue.get("new").isPresent());
        assertFalse(queue.get("old").isPresent());
    }

    @Test
    void listLimitIsBounded() {
        failOnce();
        assertEquals(1, service.list(null, 0).size());
        assertEquals(1, service.list("ops", 5000).size());
    }
}
