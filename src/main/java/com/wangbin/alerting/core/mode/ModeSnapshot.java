package com.wangbin.alerting.core.mode;

import com.wangbin.alerting.common.domain.enums.PublishingMode;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 发布模式不可变快照，由模式管理器整体替换
 */
@Value
@Builder(toBuilder = true)
public class ModeSnapshot {

    public static final String REASON_INITIAL = "initial";
    public static final String REASON_TARGETS_AVAILABLE = "targets_available";
    public static final String REASON_NO_ENABLED_TARGETS = "no_enabled_targets";

    PublishingMode mode;
    int enabledTargets;
    long transitionCount;
    Instant currentModeSince;
    String lastTransitionReason;
    Instant lastTransitionTime;
    Instant lastEvaluationTime;
    /** 最近的切换记录，旧的在前 */
    List<ModeTransition> history;

    public boolean isMetricsOnly() {
        return mode == PublishingMode.METRICS_ONLY;
    }

    public Duration currentModeDuration(Instant now) {
        return Duration.between(currentModeSince, now);
    }
}
