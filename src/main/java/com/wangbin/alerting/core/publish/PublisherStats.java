package com.wangbin.alerting.core.publish;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 发布统计快照
 */
@Value
@Builder
public class PublisherStats {

    long totalPublishes;
    long successfulPublishes;
    long failedPublishes;
    long totalRetries;
    long deadLettered;
    long deadlineExceeded;
    Map<String, TargetStats> targets;

    public double getSuccessRate() {
        return totalPublishes > 0 ? (double) successfulPublishes / totalPublishes : 0.0;
    }

    @Value
    @Builder
    public static class TargetStats {
        String targetName;
        long attempts;
        long successes;
        long failures;
        long retries;
        long averageDurationMs;
        String lastError;
        Instant lastSuccessTime;
        Instant lastFailureTime;
    }
}
