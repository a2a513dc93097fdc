package com.wangbin.alerting.core.processor;

import com.wangbin.alerting.common.domain.enums.BatchStatus;
import com.wangbin.alerting.common.domain.enums.PublishingMode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 一次Webhook批次的处理结果，与传输层无关
 */
@Value
@Builder
public class WebhookProcessingResult {

    BatchStatus status;
    String message;
    String receiver;
    List<AlertProcessingResult> alertResults;
    Summary summary;
    PublishingSummary publishingSummary;
    long processingTimeMs;

    @Value
    @Builder
    public static class Summary {
        int received;
        int processed;
        int classified;
        int filtered;
        int published;
        int failed;
    }

    @Value
    @Builder
    public static class PublishingSummary {
        int totalTargets;
        int successfulPublishes;
        int failedPublishes;
        PublishingMode mode;
        int enabledTargets;
    }
}
