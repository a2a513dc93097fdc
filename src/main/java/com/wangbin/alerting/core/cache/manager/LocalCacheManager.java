package com.wangbin.alerting.core.cache.manager;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalListener;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.wangbin.alerting.core.cache.config.CacheProperties;
import com.wangbin.alerting.core.cache.model.CacheKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 本地缓存管理器（基于Caffeine）
 *
 * 容量有界（LRU近似淘汰），每个条目按写入时指定的过期时间失效。
 */
@Slf4j
@Component("localCacheManager")
public class LocalCacheManager extends AbstractCacheManager {

    private final CacheProperties.LocalCache config;

    private Cache<String, CacheEntry> cache;

    private final RemovalListener<String, CacheEntry> removalListener =
            (key, value, cause) -> log.debug("本地缓存条目被移除: key={}, cause={}", key, cause);

    public LocalCacheManager(CacheProperties properties) {
        super("LOCAL_CAFFEINE", 1);
        this.config = properties.getLocal();
    }

    @Override
    protected void doInit() {
        cache = Caffeine.newBuilder()
                .initialCapacity(config.getInitialCapacity())
                .maximumSize(config.getMaxSize())
                .expireAfter(new EntryExpiry())
                .recordStats()
                .removalListener(removalListener)
                .build();

        log.info("本地缓存管理器初始化完成: maxSize={}, defaultExpire={}s",
                config.getMaxSize(), config.getExpireAfterWrite());
    }

    @Override
    protected void doDestroy() {
        if (cache != null) {
            cache.invalidateAll();
            cache.cleanUp();
        }
    }

    @Override
    protected <T> boolean doPut(CacheKey key, T value, long expireTime) {
        long ttlMillis = expireTime > 0 ? expireTime
                : TimeUnit.SECONDS.toMillis(config.getExpireAfterWrite());
        cache.put(key.getFullKey(), new CacheEntry(value, ttlMillis));
        return true;
    }

    @Override
    protected <T> T doGet(CacheKey key, Class<T> type) {
        CacheEntry entry = cache.getIfPresent(key.getFullKey());
        if (entry == null) {
            return null;
        }
        if (type != null && !type.isInstance(entry.value)) {
            log.warn("缓存值类型不匹配: key={}, 期望={}, 实际={}",
                    key, type.getName(), entry.value.getClass().getName());
            return null;
        }
        return type != null ? type.cast(entry.value) : null;
    }

    @Override
    protected boolean doDelete(CacheKey key) {
        return cache.asMap().remove(key.getFullKey()) != null;
    }

    @Override
    protected void doClear() {
        cache.invalidateAll();
    }

    @Override
    protected long doSize() {
        return cache.estimatedSize();
    }

    @Override
    protected Map<String, Object> getImplementationStatistics() {
        CacheStats stats = cache.stats();

        Map<String, Object> implStats = new HashMap<>();
        implStats.put("estimatedSize", cache.estimatedSize());
        implStats.put("maxSize", config.getMaxSize());
        implStats.put("evictionCount", stats.evictionCount());
        implStats.put("caffeineHitRate", String.format("%.2f%%", stats.hitRate() * 100));
        return implStats;
    }

    /**
     * 手动清理过期条目
     */
    public void cleanup() {
        cache.cleanUp();
        log.debug("本地缓存清理完成，当前大小: {}", cache.estimatedSize());
    }

    private record CacheEntry(Object value, long ttlMillis) {
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return TimeUnit.MILLISECONDS.toNanos(entry.ttlMillis());
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime,
                                      long currentDuration) {
            return TimeUnit.MILLISECONDS.toNanos(entry.ttlMillis());
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime,
                                    long currentDuration) {
            return currentDuration;
        }
    }
}
