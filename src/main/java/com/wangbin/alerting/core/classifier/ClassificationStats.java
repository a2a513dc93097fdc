package com.wangbin.alerting.core.classifier;

import lombok.Builder;
import lombok.Value;

/**
 * 分类统计快照
 */
@Value
@Builder
public class ClassificationStats {

    long totalRequests;
    long cacheHits;
    long providerCalls;
    long providerSuccesses;
    long providerFailures;
    long providerTimeouts;
    long fallbacks;
    long breakerRejected;
    String breakerState;
    boolean providerEnabled;

    public double getCacheHitRate() {
        return totalRequests > 0 ? (double) cacheHits / totalRequests : 0.0;
    }

    public double getFallbackRate() {
        return totalRequests > 0 ? (double) fallbacks / totalRequests : 0.0;
    }
}
