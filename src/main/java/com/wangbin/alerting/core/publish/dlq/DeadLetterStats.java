package com.wangbin.alerting.core.publish.dlq;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class DeadLetterStats {
    int size;
    int maxSize;
    long totalAdded;
    long totalEvicted;
    long totalRemoved;
    long totalPurged;
    Map<String, Integer> byTarget;
    Instant oldestFailedAt;
}
