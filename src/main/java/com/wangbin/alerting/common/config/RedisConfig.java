package com.wangbin.alerting.common.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 二级缓存使用的Redis模板，值以JSON字符串存储，由缓存管理器按目标类型反序列化
 */
@Configuration
@ConditionalOnProperty(name = "alerting.cache.redis.enabled", havingValue = "true")
public class RedisConfig {

    @Bean("cacheRedisTemplate")
    public StringRedisTemplate cacheRedisTemplate(RedisConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate(connectionFactory);
        template.setEnableTransactionSupport(false);
        template.afterPropertiesSet();
        return template;
    }
}
