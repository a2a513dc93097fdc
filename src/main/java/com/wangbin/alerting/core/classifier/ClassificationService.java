package com.wangbin.alerting.core.classifier;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.enums.ClassificationSource;
import com.wangbin.alerting.common.utils.Deadline;
import com.wangbin.alerting.core.cache.manager.MultiLevelCacheManager;
import com.wangbin.alerting.core.cache.model.CacheKey;
import com.wangbin.alerting.core.classifier.config.ClassificationProperties;
import com.wangbin.alerting.core.classifier.provider.ClassificationProvider;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 告警分类服务
 *
 * 执行顺序：
 * 1. 按指纹查多级缓存，命中直接返回（source=cache）
 * 2. 未命中时向熔断器申请许可，熔断打开则直接降级
 * 3. 在分类线程池中调用外部服务，等待时间不超过 min(超时, 请求剩余时间)
 * 4. 成功写缓存并返回（source=provider），失败或超时记入熔断器后降级（source=fallback）
 *
 * 降级结果不写缓存，服务恢复后下一次未命中即可重新获得外部分类。
 */
@Slf4j
@Service
public class ClassificationService {

    private final ClassificationProperties properties;
    private final MultiLevelCacheManager cacheManager;
    private final ClassificationProvider provider;
    private final FallbackClassifier fallbackClassifier;
    private final ExecutorService classificationExecutor;
    private final CircuitBreaker circuitBreaker;

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong providerCalls = new AtomicLong(0);
    private final AtomicLong providerSuccesses = new AtomicLong(0);
    private final AtomicLong providerFailures = new AtomicLong(0);
    private final AtomicLong providerTimeouts = new AtomicLong(0);
    private final AtomicLong fallbacks = new AtomicLong(0);
    private final AtomicLong breakerRejected = new AtomicLong(0);

    public ClassificationService(ClassificationProperties properties,
                                 MultiLevelCacheManager cacheManager,
                                 ClassificationProvider provider,
                                 FallbackClassifier fallbackClassifier,
                                 @Qualifier("classificationExecutor") ExecutorService classificationExecutor) {
        this.properties = properties;
        this.cacheManager = cacheManager;
        this.provider = provider;
        this.fallbackClassifier = fallbackClassifier;
        this.classificationExecutor = classificationExecutor;
        this.circuitBreaker = buildCircuitBreaker(properties);
    }

    /**
     * 使用默认超时分类
     */
    public Classification classify(Alert alert) {
        return classify(alert, Deadline.after(properties.getTimeout()));
    }

    /**
     * 分类单条告警，从不抛出外部服务相关异常
     */
    public Classification classify(Alert alert, Deadline deadline) {
        totalRequests.incrementAndGet();
        CacheKey key = CacheKey.classification(alert.getFingerprint(), properties.getCacheTtl().toMillis());

        Classification cached = cacheManager.get(key, Classification.class);
        if (cached != null) {
            cacheHits.incrementAndGet();
            log.debug("分类缓存命中: fingerprint={}", alert.getFingerprint());
            return cached.withSource(ClassificationSource.CACHE);
        }

        if (!properties.isProviderEnabled()) {
            return fallback(alert, "分类服务未启用");
        }
        if (deadline.isExpired()) {
            return fallback(alert, "请求截止时间已到");
        }
        if (!circuitBreaker.tryAcquirePermission()) {
            breakerRejected.incrementAndGet();
            return fallback(alert, "熔断器打开");
        }

        Classification result = callProvider(alert, deadline);
        if (result != null) {
            cacheManager.put(key, result);
            return result;
        }
        return fallback(alert, "分类服务调用失败");
    }

    /**
     * 失效指定指纹的缓存
     */
    public boolean invalidate(String fingerprint) {
        CacheKey key = CacheKey.classification(fingerprint, properties.getCacheTtl().toMillis());
        boolean deleted = cacheManager.delete(key);
        log.info("失效分类缓存: fingerprint={}, deleted={}", fingerprint, deleted);
        return deleted;
    }

    public ClassificationStats getStats() {
        return ClassificationStats.builder()
                .totalRequests(totalRequests.get())
                .cacheHits(cacheHits.get())
                .providerCalls(providerCalls.get())
                .providerSuccesses(providerSuccesses.get())
                .providerFailures(providerFailures.get())
                .providerTimeouts(providerTimeouts.get())
                .fallbacks(fallbacks.get())
                .breakerRejected(breakerRejected.get())
                .breakerState(circuitBreaker.getState().name())
                .providerEnabled(properties.isProviderEnabled())
                .build();
    }

    public CircuitBreaker.State getBreakerState() {
        return circuitBreaker.getState();
    }

    /**
     * 已获得熔断器许可，返回null表示调用失败
     */
    private Classification callProvider(Alert alert, Deadline deadline) {
        long timeoutMillis = deadline.boundedMillis(properties.getTimeout().toMillis());
        long start = System.nanoTime();
        providerCalls.incrementAndGet();

        Future<Classification> future;
        try {
            future = classificationExecutor.submit(
                    () -> provider.classify(alert, Duration.ofMillis(timeoutMillis)));
        } catch (RejectedExecutionException e) {
            circuitBreaker.releasePermission();
            log.warn("分类线程池已满，降级处理: fingerprint={}", alert.getFingerprint());
            return null;
        }

        try {
            Classification result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (result == null) {
                providerFailures.incrementAndGet();
                circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS,
                        new IllegalStateException("分类服务返回空结果"));
                log.warn("分类服务返回空结果: fingerprint={}", alert.getFingerprint());
                return null;
            }
            circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            providerSuccesses.incrementAndGet();
            log.debug("分类服务调用成功: fingerprint={}, severity={}, cost={}ms",
                    alert.getFingerprint(), result.getSeverity(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return result.getSource() == ClassificationSource.PROVIDER
                    ? result : result.withSource(ClassificationSource.PROVIDER);
        } catch (TimeoutException e) {
            future.cancel(true);
            providerTimeouts.incrementAndGet();
            providerFailures.incrementAndGet();
            circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            log.warn("分类服务调用超时: fingerprint={}, timeout={}ms", alert.getFingerprint(), timeoutMillis);
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            providerFailures.incrementAndGet();
            circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, cause);
            log.warn("分类服务调用失败: fingerprint={}, error={}", alert.getFingerprint(), cause.getMessage());
            return null;
        } catch (InterruptedException e) {
            // 上层请求被取消，不计入外部服务失败
            future.cancel(true);
            circuitBreaker.releasePermission();
            Thread.currentThread().interrupt();
            log.debug("分类等待被中断: fingerprint={}", alert.getFingerprint());
            return null;
        }
    }

    private Classification fallback(Alert alert, String reason) {
        fallbacks.incrementAndGet();
        log.warn("告警分类降级: fingerprint={}, alertname={}, reason={}",
                alert.getFingerprint(), alert.alertName(), reason);
        return fallbackClassifier.classify(alert);
    }

    private static CircuitBreaker buildCircuitBreaker(ClassificationProperties properties) {
        int threshold = Math.max(1, properties.getFailureThreshold());
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                // 窗口内全部失败才打开，即连续 threshold 次失败
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(properties.getBreakerCooldown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordExceptions(Throwable.class)
                .build();

        CircuitBreaker breaker = CircuitBreaker.of("classification-provider", config);
        breaker.getEventPublisher().onStateTransition(event ->
                log.info("分类服务熔断器状态变化: {}", event.getStateTransition()));
        return breaker;
    }
}
