package com.wangbin.alerting.core.cache.manager;

import com.wangbin.alerting.core.cache.model.CacheKey;

import java.util.Map;

/**
 * 缓存管理器接口
 */
public interface CacheManager {

    /**
     * 初始化缓存管理器
     */
    void init();

    /**
     * 销毁缓存管理器
     */
    void destroy();

    /**
     * 存入缓存（使用键自带的过期时间）
     */
    <T> boolean put(CacheKey key, T value);

    /**
     * 存入缓存（过期时间毫秒）
     */
    <T> boolean put(CacheKey key, T value, long expireTime);

    /**
     * 获取缓存，类型不匹配或未命中返回null
     */
    <T> T get(CacheKey key, Class<T> type);

    /**
     * 删除缓存
     */
    boolean delete(CacheKey key);

    /**
     * 清除所有缓存
     */
    void clear();

    /**
     * 获取缓存大小
     */
    long size();

    /**
     * 获取缓存统计信息
     */
    Map<String, Object> getStatistics();

    /**
     * 获取缓存层级
     */
    int getCacheLevel();

    /**
     * 获取缓存类型
     */
    String getCacheType();
}
