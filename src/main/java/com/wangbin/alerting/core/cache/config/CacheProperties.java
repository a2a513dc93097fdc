package com.wangbin.alerting.core.cache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 缓存配置属性
 */
@ConfigurationProperties(prefix = "alerting.cache")
@Data
public class CacheProperties {

    private LocalCache local = new LocalCache();
    private RedisCache redis = new RedisCache();

    @Data
    public static class LocalCache {
        private long maxSize = 10000;
        private long expireAfterWrite = 900; // 秒
        private int initialCapacity = 256;
    }

    @Data
    public static class RedisCache {
        private boolean enabled = false;
        private String keyPrefix = "alerting:";
        private long defaultExpire = 900; // 秒
    }
}
