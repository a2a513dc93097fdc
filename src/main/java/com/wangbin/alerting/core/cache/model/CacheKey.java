package com.wangbin.alerting.core.cache.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 缓存键
 *
 * fullKey = namespace + ":" + key，过期时间单位为毫秒。
 */
@Getter
@EqualsAndHashCode(of = "fullKey")
public class CacheKey {

    /** 使用缓存管理器默认过期时间 */
    public static final long EXPIRE_DEFAULT = 0L;

    public static final String NS_CLASSIFICATION = "classification";

    private final String namespace;
    private final String key;
    private final String fullKey;
    private final long expireTime;

    public CacheKey(String namespace, String key, long expireTime) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("缓存键不能为空");
        }
        this.namespace = namespace;
        this.key = key;
        this.fullKey = namespace == null || namespace.isEmpty() ? key : namespace + ":" + key;
        this.expireTime = expireTime;
    }

    public static CacheKey classification(String fingerprint, long expireTime) {
        return new CacheKey(NS_CLASSIFICATION, fingerprint, expireTime);
    }

    @Override
    public String toString() {
        return fullKey;
    }
}
