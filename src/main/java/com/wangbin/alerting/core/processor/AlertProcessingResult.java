package com.wangbin.alerting.core.processor;

import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.FilterDecision;
import com.wangbin.alerting.common.domain.entity.PublishResult;
import com.wangbin.alerting.common.domain.enums.AlertOutcome;
import com.wangbin.alerting.common.domain.enums.AlertStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 单条告警的处理结果
 */
@Value
@Builder
public class AlertProcessingResult {

    int index;
    String fingerprint;
    String alertName;
    AlertStatus alertStatus;
    AlertOutcome outcome;
    Classification classification;
    FilterDecision filterDecision;
    @Builder.Default
    List<PublishResult> publishResults = List.of();
    String error;
    long processingTimeMs;

    public long successfulPublishes() {
        return publishResults.stream().filter(PublishResult::isSuccess).count();
    }

    public long failedPublishes() {
        return publishResults.size() - successfulPublishes();
    }
}
