package com.wangbin.alerting.core.classifier;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.enums.ClassificationSource;
import com.wangbin.alerting.common.domain.enums.Severity;
import com.wangbin.alerting.common.utils.Deadline;
import com.wangbin.alerting.core.cache.config.CacheProperties;
import com.wangbin.alerting.core.cache.manager.LocalCacheManager;
import com.wangbin.alerting.core.cache.manager.MultiLevelCacheManager;
import com.wangbin.alerting.core.classifier.config.ClassificationProperties;
import com.wangbin.alerting.core.classifier.provider.ClassificationProvider;
import com.wangbin.alerting.core.classifier.provider.ClassificationProviderException;
import com.wangbin.alerting.support.TestAlerts;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationServiceTest {

    private ClassificationProperties properties;
    private MultiLevelCacheManager cacheManager;
    private ExecutorService executor;
    private StubProvider provider;

    @BeforeEach
    void setUp() {
        properties = new ClassificationProperties();
        properties.setFailureThreshold(3);
        properties.setBreakerCooldown(Duration.ofMillis(100));
        properties.setTimeout(Duration.ofMillis(500));

        cacheManager = new MultiLevelCacheManager(List.of(new LocalCacheManager(new CacheProperties())));
        cacheManager.init();
        executor = Executors.newCachedThreadPool();
        provider = new StubProvider();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        cacheManager.destroy();
    }

    private ClassificationService service() {
        return new ClassificationService(properties, cacheManager, provider,
                new FallbackClassifier(properties), executor);
    }

    @Test
    void secondClassificationOfSameFingerprintIsServedFromCache() {
        ClassificationService service = service();
        Alert alert = TestAlerts.alert("NodeDown", "critical");

        Classification first = service.classify(alert);
        Classification second = service.classify(alert);

        assertEquals(ClassificationSource.PROVIDER, first.getSource());
        assertEquals(ClassificationSource.CACHE, second.getSource());
        assertEquals(first.getSeverity(), second.getSeverity());
        assertEquals(1, provider.calls.get(), "缓存命中不应调用外部服务");
        assertEquals(1, service.getStats().getCacheHits());
    }

    @Test
    void invalidateForcesProviderCallAgain() {
        ClassificationService service = service();
        Alert alert = TestAlerts.alert("NodeDown", "critical");

        service.classify(alert);
        assertTrue(service.invalidate(alert.getFingerprint()));
        Classification again = service.classify(alert);

        assertEquals(ClassificationSource.PROVIDER, again.getSource());
        assertEquals(2, provider.calls.get());
    }

    @Test
    void breakerOpensAfterConsecutiveFailuresAndSkipsProvider() {
        provider.fail = true;
        ClassificationService service = service();

        for (int i = 0; i < 3; i++) {
            Classification c = service.classify(TestAlerts.alert("Alert" + i, "warning"));
            assertEquals(ClassificationSource.FALLBACK, c.getSource());
        }
        assertEquals(CircuitBreaker.State.OPEN, service.getBreakerState());

        Classification rejected = service.classify(TestAlerts.alert("Another", "warning"));
        assertEquals(ClassificationSource.FALLBACK, rejected.getSource());
        assertEquals(3, provider.calls.get(), "熔断打开后不应再调用外部服务");
        assertEquals(1, service.getStats().getBreakerRejected());
    }

    @Test
    void singleTrialCallAfterCooldownClosesBreakerOnSuccess() throws InterruptedException {
        provider.fail = true;
        ClassificationService service = service();
        for (int i = 0; i < 3; i++) {
            service.classify(TestAlerts.alert("Alert" + i, "warning"));
        }
        assertEquals(CircuitBreaker.State.OPEN, service.getBreakerState());

        Thread.sleep(150);
        provider.fail = false;

        Classification trial = service.classify(TestAlerts.alert("HalfOpenTrial", "critical"));
        assertEquals(ClassificationSource.PROVIDER, trial.getSource());
        assertEquals(4, provider.calls.get());
        assertEquals(CircuitBreaker.State.CLOSED, service.getBreakerState());
    }

    @Test
    void failedTrialCallReopensBreaker() throws InterruptedException {
        provider.fail = true;
        ClassificationService service = service();
        for (int i = 0; i < 3; i++) {
            service.classify(TestAlerts.alert("Alert" + i, "warning"));
        }

        Thread.sleep(150);
        Classification trial = service.classify(TestAlerts.alert("HalfOpenTrial", "critical"));

        assertEquals(ClassificationSource.FALLBACK, trial.getSource());
        assertEquals(4, provider.calls.get());
        assertEquals(CircuitBreaker.State.OPEN, service.getBreakerState());

        service.classify(TestAlerts.alert("AfterTrial", "critical"));
        assertEquals(4, provider.calls.get(), "重新打开后冷却期内不放行");
    }

    @Test
    void slowProviderTimesOutToFallbackWithFixedConfidence() {
        provider.delayMillis = 2000;
        properties.setTimeout(Duration.ofMillis(100));
        ClassificationService service = service();

        long start = System.currentTimeMillis();
        Classification c = service.classify(TestAlerts.alert("HighCPU", "critical"));
        long elapsed = System.currentTimeMillis() - start;

        assertEquals(ClassificationSource.FALLBACK, c.getSource());
        assertEquals(0.6, c.getConfidence(), 1e-9);
        assertEquals(Severity.CRITICAL, c.getSeverity());
        assertTrue(elapsed < 1000, "等待时间应受超时限制: " + elapsed);
        assertEquals(1, service.getStats().getProviderTimeouts());
    }

    @Test
    void expiredDeadlineSkipsProvider() {
        ClassificationService service = service();
        Classification c = service.classify(TestAlerts.alert("HighCPU", "critical"), Deadline.afterMillis(0));

        assertEquals(ClassificationSource.FALLBACK, c.getSource());
        assertEquals(0, provider.calls.get());
    }

    @Test
    void fallbackResultsAreNotCached() {
        provider.fail = true;
        ClassificationService service = service();
        Alert alert = TestAlerts.alert("NodeDown", "critical");

        service.classify(alert);
        provider.fail = false;
        Classification recovered = service.classify(alert);

        assertEquals(ClassificationSource.PROVIDER, recovered.getSource());
    }

    @Test
    void disabledProviderAlwaysFallsBack() {
        properties.setProviderEnabled(false);
        ClassificationService service = service();

        Classification c = service.classify(TestAlerts.alert(Map.of("alertname", "DiskFull", "severity", "warning")));

        assertEquals(ClassificationSource.FALLBACK, c.getSource());
        assertEquals(0, provider.calls.get());
        assertFalse(service.getStats().isProviderEnabled());
    }

    private static class StubProvider implements ClassificationProvider {
        final AtomicInteger calls = new AtomicInteger();
        volatile boolean fail;
        volatile long delayMillis;

        @Override
        public Classification classify(Alert alert, Duration timeout) throws ClassificationProviderException {
            calls.incrementAndGet();
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ClassificationProviderException("interrupted");
                }
            }
            if (fail) {
                throw new ClassificationProviderException("provider unavailable");
            }
            return TestAlerts.classification(Severity.fromCode(alert.label("severity")));
        }

        @Override
        public String getName() {
            return "stub";
        }
    }
}
