package com.wangbin.alerting.core.cache.manager;

import com.wangbin.alerting.core.cache.model.CacheKey;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 多级缓存管理器
 *
 * 读：按层级从低到高逐级查找，高层命中时回填低层。
 * 写：写穿透，所有层级同时写入。
 * 初始化失败的层级被剔除，系统以剩余层级降级运行。
 */
@Slf4j
@Component("multiLevelCacheManager")
public class MultiLevelCacheManager {

    private final List<CacheManager> configuredManagers;

    // 缓存管理器列表（按层级排序，仅包含初始化成功的层级）
    private final List<CacheManager> cacheManagers = new CopyOnWriteArrayList<>();
    private final List<String> failedLevels = new CopyOnWriteArrayList<>();

    // 统计信息
    private final AtomicLong totalReads = new AtomicLong(0);
    private final AtomicLong totalWrites = new AtomicLong(0);
    private final AtomicLong totalMisses = new AtomicLong(0);
    private final Map<Integer, AtomicLong> levelHits = new LinkedHashMap<>();

    @Autowired
    public MultiLevelCacheManager(LocalCacheManager localCacheManager,
                                  ObjectProvider<RedisCacheManager> redisCacheManager) {
        List<CacheManager> managers = new ArrayList<>();
        managers.add(localCacheManager);
        redisCacheManager.ifAvailable(managers::add);
        this.configuredManagers = managers;
    }

    public MultiLevelCacheManager(List<? extends CacheManager> managers) {
        this.configuredManagers = new ArrayList<>(managers);
    }

    @PostConstruct
    public void init() {
        List<CacheManager> sorted = new ArrayList<>(configuredManagers);
        sorted.sort(Comparator.comparingInt(CacheManager::getCacheLevel));

        for (CacheManager manager : sorted) {
            try {
                manager.init();
                cacheManagers.add(manager);
                levelHits.put(manager.getCacheLevel(), new AtomicLong(0));
            } catch (Exception e) {
                failedLevels.add(manager.getCacheType());
                log.error("缓存层级初始化失败，降级运行: {}", manager.getCacheType(), e);
            }
        }

        log.info("多级缓存管理器初始化完成，层级数: {}, 失败层级: {}",
                cacheManagers.size(), failedLevels);
    }

    @PreDestroy
    public void destroy() {
        for (CacheManager manager : cacheManagers) {
            manager.destroy();
        }
        cacheManagers.clear();
        log.info("多级缓存管理器已销毁");
    }

    public <T> T get(CacheKey key, Class<T> type) {
        if (key == null) {
            return null;
        }
        totalReads.incrementAndGet();

        for (int i = 0; i < cacheManagers.size(); i++) {
            CacheManager manager = cacheManagers.get(i);
            T value = manager.get(key, type);
            if (value != null) {
                levelHits.get(manager.getCacheLevel()).incrementAndGet();
                if (i > 0) {
                    backfill(key, value, i);
                }
                return value;
            }
        }

        totalMisses.incrementAndGet();
        return null;
    }

    public <T> boolean put(CacheKey key, T value) {
        if (key == null || value == null) {
            return false;
        }
        totalWrites.incrementAndGet();

        boolean allSuccess = true;
        for (CacheManager manager : cacheManagers) {
            if (!manager.put(key, value, key.getExpireTime())) {
                allSuccess = false;
                log.warn("缓存写入失败: {} [Level: {}]", key, manager.getCacheLevel());
            }
        }
        return allSuccess;
    }

    public boolean delete(CacheKey key) {
        boolean deleted = false;
        for (CacheManager manager : cacheManagers) {
            deleted |= manager.delete(key);
        }
        return deleted;
    }

    public void clear() {
        for (CacheManager manager : cacheManagers) {
            manager.clear();
        }
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("levels", cacheManagers.size());
        stats.put("totalReads", totalReads.get());
        stats.put("totalWrites", totalWrites.get());
        stats.put("totalMisses", totalMisses.get());

        Map<String, Object> hits = new LinkedHashMap<>();
        levelHits.forEach((level, count) -> hits.put("level" + level, count.get()));
        stats.put("levelHits", hits);

        long reads = totalReads.get();
        double hitRate = reads > 0 ? (double) (reads - totalMisses.get()) / reads * 100 : 0.0;
        stats.put("hitRate", String.format("%.2f%%", hitRate));

        List<Map<String, Object>> managerStats = new ArrayList<>();
        for (CacheManager manager : cacheManagers) {
            managerStats.add(manager.getStatistics());
        }
        stats.put("managers", managerStats);
        return stats;
    }

    /**
     * 缓存健康状态：全部层级可用为UP，部分层级失败为DEGRADED，无可用层级为DOWN
     */
    public Map<String, Object> getHealthStatus() {
        Map<String, Object> health = new LinkedHashMap<>();
        String overall;
        if (cacheManagers.isEmpty()) {
            overall = "DOWN";
        } else if (!failedLevels.isEmpty()) {
            overall = "DEGRADED";
        } else {
            overall = "UP";
        }
        health.put("overallStatus", overall);
        health.put("activeLevels", cacheManagers.stream().map(CacheManager::getCacheType).collect(Collectors.toList()));
        health.put("failedLevels", List.copyOf(failedLevels));
        return health;
    }

    private <T> void backfill(CacheKey key, T value, int hitIndex) {
        for (int i = 0; i < hitIndex; i++) {
            CacheManager lower = cacheManagers.get(i);
            lower.put(key, value, key.getExpireTime());
            log.debug("缓存回填: {} -> Level {}", key, lower.getCacheLevel());
        }
    }
}
