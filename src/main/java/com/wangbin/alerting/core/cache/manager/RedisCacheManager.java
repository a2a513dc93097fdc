package com.wangbin.alerting.core.cache.manager;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.alerting.core.cache.config.CacheProperties;
import com.wangbin.alerting.core.cache.model.CacheKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Redis缓存管理器（二级缓存，跨实例共享）
 *
 * 值以JSON字符串存储，读取时按调用方给定的类型反序列化。
 */
@Slf4j
@Component("redisCacheManager")
@ConditionalOnProperty(name = "alerting.cache.redis.enabled", havingValue = "true")
public class RedisCacheManager extends AbstractCacheManager {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final CacheProperties.RedisCache config;

    public RedisCacheManager(@Qualifier("cacheRedisTemplate") StringRedisTemplate redisTemplate,
                             ObjectMapper objectMapper,
                             CacheProperties properties) {
        super("REDIS", 2);
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getRedis();
    }

    @Override
    protected void doInit() throws Exception {
        testConnection();
        log.info("Redis缓存管理器初始化完成: keyPrefix={}, defaultExpire={}s",
                config.getKeyPrefix(), config.getDefaultExpire());
    }

    @Override
    protected void doDestroy() {
        log.info("Redis缓存管理器已销毁");
    }

    @Override
    protected <T> boolean doPut(CacheKey key, T value, long expireTime) throws Exception {
        String json = objectMapper.writeValueAsString(value);
        long expireMillis = expireTime > 0 ? expireTime
                : TimeUnit.SECONDS.toMillis(config.getDefaultExpire());
        redisTemplate.opsForValue().set(buildRedisKey(key), json, expireMillis, TimeUnit.MILLISECONDS);
        return true;
    }

    @Override
    protected <T> T doGet(CacheKey key, Class<T> type) throws Exception {
        String json = redisTemplate.opsForValue().get(buildRedisKey(key));
        if (json == null) {
            return null;
        }
        return objectMapper.readValue(json, type);
    }

    @Override
    protected boolean doDelete(CacheKey key) {
        Boolean deleted = redisTemplate.delete(buildRedisKey(key));
        return Boolean.TRUE.equals(deleted);
    }

    @Override
    protected void doClear() {
        Set<String> keys = redisTemplate.keys(config.getKeyPrefix() + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }

    @Override
    protected long doSize() {
        Set<String> keys = redisTemplate.keys(config.getKeyPrefix() + "*");
        return keys == null ? 0 : keys.size();
    }

    @Override
    protected Map<String, Object> getImplementationStatistics() {
        return Map.of("keyPrefix", config.getKeyPrefix());
    }

    private String buildRedisKey(CacheKey key) {
        return config.getKeyPrefix() + key.getFullKey();
    }

    /**
     * 测试Redis连接
     */
    private void testConnection() throws Exception {
        String testKey = config.getKeyPrefix() + "test:connection";
        try {
            redisTemplate.opsForValue().set(testKey, "test", 10, TimeUnit.SECONDS);
            String result = redisTemplate.opsForValue().get(testKey);
            if (!"test".equals(result)) {
                throw new IllegalStateException("Redis连接测试失败: 返回值不匹配");
            }
            redisTemplate.delete(testKey);
            log.debug("Redis连接测试成功");
        } catch (Exception e) {
            throw new Exception("Redis连接失败: " + e.getMessage(), e);
        }
    }
}
