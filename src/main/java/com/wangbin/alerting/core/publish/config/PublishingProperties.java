package com.wangbin.alerting.core.publish.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 发布配置：目标列表、并发、超时、重试与死信
 */
@Data
@ConfigurationProperties(prefix = "alerting.publishing")
public class PublishingProperties {

    /** 单条告警发布的最大并发目标数 */
    private int maxConcurrency = 10;

    /** 单个目标单次投递超时 */
    private Duration targetTimeout = Duration.ofSeconds(5);

    /** 目标列表刷新间隔（毫秒） */
    private long refreshIntervalMs = 30000;

    /** 模式检查间隔（毫秒） */
    private long modeCheckIntervalMs = 1000;

    /** 模式切换历史保留条数 */
    private int modeHistorySize = 50;

    private Retry retry = new Retry();

    private DeadLetter dlq = new DeadLetter();

    private List<TargetConfig> targets = new ArrayList<>();

    @Data
    public static class Retry {
        private int maxRetries = 3;
        /** 第 n 次重试前的等待时间，超出部分沿用最后一个值 */
        private List<Duration> backoff = new ArrayList<>(List.of(
                Duration.ofMillis(100), Duration.ofMillis(500), Duration.ofSeconds(2)));
    }

    @Data
    public static class DeadLetter {
        private boolean enabled = true;
        private int maxSize = 10000;
        /** 超过保留时间的死信被定时清理 */
        private Duration retention = Duration.ofDays(7);
        /** 过期死信清理间隔（毫秒） */
        private long purgeIntervalMs = 3600000;
    }

    @Data
    public static class TargetConfig {
        private String name;
        private String type = "webhook";
        private boolean enabled = true;
        private String url;
        private Map<String, String> headers = new LinkedHashMap<>();
    }
}
