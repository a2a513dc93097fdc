package com.wangbin.alerting.core.classifier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 告警分类配置
 */
@Data
@ConfigurationProperties(prefix = "alerting.classification")
public class ClassificationProperties {

    /** 是否调用外部分类服务，关闭时缓存未命中直接走降级规则 */
    private boolean providerEnabled = true;

    /** 外部分类服务地址 */
    private String providerUrl = "http://localhost:8090/api/v1/classify";

    /** 单次调用超时 */
    private Duration timeout = Duration.ofSeconds(5);

    /** 建立连接超时 */
    private Duration connectTimeout = Duration.ofSeconds(2);

    /** 分类结果缓存时间 */
    private Duration cacheTtl = Duration.ofMinutes(15);

    /** 连续失败多少次后熔断 */
    private int failureThreshold = 5;

    /** 熔断冷却时间，之后放行一次探测调用 */
    private Duration breakerCooldown = Duration.ofSeconds(30);

    /** 降级结果的置信度 */
    private double fallbackConfidence = 0.6;
}
