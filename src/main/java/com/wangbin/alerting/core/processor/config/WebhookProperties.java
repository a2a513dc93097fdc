package com.wangbin.alerting.core.processor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Webhook处理配置
 */
@Data
@ConfigurationProperties(prefix = "alerting.webhook")
public class WebhookProperties {

    /** 整个请求的处理时限 */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /** 批次内并发处理的告警数 */
    private int maxConcurrency = 10;

    /** 单个请求允许的最大告警数 */
    private int maxAlertsPerRequest = 1000;

    /** 最近告警保留条数 */
    private int historySize = 1000;
}
