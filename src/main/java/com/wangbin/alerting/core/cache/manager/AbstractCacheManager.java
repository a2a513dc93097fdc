package com.wangbin.alerting.core.cache.manager;

import com.wangbin.alerting.core.cache.model.CacheKey;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 抽象缓存管理器
 *
 * 统一处理初始化检查、统计计数和异常吞吐，子类只实现 doXxx 方法。
 * 缓存读写异常只计数和记录日志，不向调用方抛出，缓存不可用时按未命中处理。
 */
@Slf4j
public abstract class AbstractCacheManager implements CacheManager {

    /** 单次操作超过该耗时记录告警，分类缓存位于告警处理的关键路径上 */
    private static final long SLOW_OPERATION_MS = 50;

    protected final String cacheType;
    protected final int cacheLevel;
    protected volatile boolean initialized = false;

    // 统计信息
    protected final AtomicLong totalPuts = new AtomicLong(0);
    protected final AtomicLong totalGets = new AtomicLong(0);
    protected final AtomicLong totalHits = new AtomicLong(0);
    protected final AtomicLong totalMisses = new AtomicLong(0);
    protected final AtomicLong totalDeletes = new AtomicLong(0);
    protected final AtomicLong totalErrors = new AtomicLong(0);

    protected AbstractCacheManager(String cacheType, int cacheLevel) {
        this.cacheType = cacheType;
        this.cacheLevel = cacheLevel;
    }

    @Override
    public synchronized void init() {
        if (initialized) {
            log.warn("缓存管理器已经初始化: {}", cacheType);
            return;
        }

        try {
            doInit();
            initialized = true;
            log.info("缓存管理器初始化完成: {} [Level: {}]", cacheType, cacheLevel);
        } catch (Exception e) {
            log.error("缓存管理器初始化失败: {}", cacheType, e);
            throw new IllegalStateException("缓存管理器初始化失败: " + cacheType, e);
        }
    }

    @Override
    public synchronized void destroy() {
        if (!initialized) {
            return;
        }

        try {
            doDestroy();
            initialized = false;
            log.info("缓存管理器销毁完成: {}", cacheType);
        } catch (Exception e) {
            log.error("缓存管理器销毁失败: {}", cacheType, e);
        }
    }

    @Override
    public <T> boolean put(CacheKey key, T value) {
        return put(key, value, key.getExpireTime());
    }

    @Override
    public <T> boolean put(CacheKey key, T value, long expireTime) {
        checkInitialized();

        if (key == null || value == null) {
            log.warn("缓存键或值为空，跳过缓存: {}", key);
            return false;
        }

        long startNanos = System.nanoTime();
        try {
            boolean success = doPut(key, value, expireTime);
            if (success) {
                totalPuts.incrementAndGet();
                log.debug("缓存写入成功: {} [{}]", key, cacheType);
            } else {
                totalErrors.incrementAndGet();
                log.warn("缓存写入失败: {} [{}]", key, cacheType);
            }
            return success;
        } catch (Exception e) {
            totalErrors.incrementAndGet();
            log.error("缓存写入异常: {} [{}]", key, cacheType, e);
            return false;
        } finally {
            warnIfSlow("写入", key, startNanos);
        }
    }

    @Override
    public <T> T get(CacheKey key, Class<T> type) {
        checkInitialized();

        if (key == null) {
            return null;
        }

        long startNanos = System.nanoTime();
        try {
            T value = doGet(key, type);

            totalGets.incrementAndGet();
            if (value != null) {
                totalHits.incrementAndGet();
                log.debug("缓存命中: {} [{}]", key, cacheType);
            } else {
                totalMisses.incrementAndGet();
                log.debug("缓存未命中: {} [{}]", key, cacheType);
            }
            return value;
        } catch (Exception e) {
            totalErrors.incrementAndGet();
            log.error("缓存读取异常: {} [{}]", key, cacheType, e);
            return null;
        } finally {
            warnIfSlow("读取", key, startNanos);
        }
    }

    @Override
    public boolean delete(CacheKey key) {
        checkInitialized();

        if (key == null) {
            return false;
        }

        try {
            boolean success = doDelete(key);
            if (success) {
                totalDeletes.incrementAndGet();
                log.debug("缓存删除成功: {} [{}]", key, cacheType);
            }
            return success;
        } catch (Exception e) {
            totalErrors.incrementAndGet();
            log.error("缓存删除异常: {} [{}]", key, cacheType, e);
            return false;
        }
    }

    @Override
    public void clear() {
        checkInitialized();

        try {
            doClear();
            log.info("缓存清空完成: {}", cacheType);
        } catch (Exception e) {
            totalErrors.incrementAndGet();
            log.error("清空缓存异常: {}", cacheType, e);
        }
    }

    @Override
    public long size() {
        checkInitialized();

        try {
            return doSize();
        } catch (Exception e) {
            totalErrors.incrementAndGet();
            log.error("获取缓存大小异常: {}", cacheType, e);
            return 0;
        }
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("cacheType", cacheType);
        stats.put("cacheLevel", cacheLevel);
        stats.put("initialized", initialized);
        stats.put("totalPuts", totalPuts.get());
        stats.put("totalGets", totalGets.get());
        stats.put("totalHits", totalHits.get());
        stats.put("totalMisses", totalMisses.get());
        stats.put("totalDeletes", totalDeletes.get());
        stats.put("totalErrors", totalErrors.get());

        stats.put("hitRate", getHitRate());
        stats.put("cacheSize", initialized ? size() : 0);

        Map<String, Object> implStats = getImplementationStatistics();
        if (implStats != null) {
            stats.putAll(implStats);
        }
        return stats;
    }

    @Override
    public int getCacheLevel() {
        return cacheLevel;
    }

    @Override
    public String getCacheType() {
        return cacheType;
    }

    /**
     * 命中率 [0, 1]，没有读取时为0
     */
    public double getHitRate() {
        long gets = totalGets.get();
        return gets > 0 ? (double) totalHits.get() / gets : 0.0;
    }

    private void warnIfSlow(String operation, CacheKey key, long startNanos) {
        long costMs = (System.nanoTime() - startNanos) / 1_000_000;
        if (costMs > SLOW_OPERATION_MS) {
            log.warn("缓存{}耗时过长: {}ms, key={}, level={}", operation, costMs, key, cacheLevel);
        }
    }

    // =============== 抽象方法 ===============

    protected abstract void doInit() throws Exception;
    protected abstract void doDestroy() throws Exception;
    protected abstract <T> boolean doPut(CacheKey key, T value, long expireTime) throws Exception;
    protected abstract <T> T doGet(CacheKey key, Class<T> type) throws Exception;
    protected abstract boolean doDelete(CacheKey key) throws Exception;
    protected abstract void doClear() throws Exception;
    protected abstract long doSize() throws Exception;

    /**
     * 获取实现特定的统计信息
     */
    protected Map<String, Object> getImplementationStatistics() {
        return null;
    }

    protected void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("缓存管理器未初始化: " + cacheType);
        }
    }
}
