package com.wangbin.alerting.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.FilterDecision;
import com.wangbin.alerting.common.domain.enums.AlertOutcome;
import com.wangbin.alerting.common.domain.enums.BatchStatus;
import com.wangbin.alerting.common.domain.enums.FilterAction;
import com.wangbin.alerting.common.domain.enums.PublishingMode;
import com.wangbin.alerting.core.processor.AlertProcessingResult;
import com.wangbin.alerting.core.processor.WebhookProcessingResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * POST /webhook 响应体
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WebhookResponse {

    BatchStatus status;
    String message;
    String receiver;
    List<AlertResult> alertResults;
    WebhookProcessingResult.Summary summary;
    PublishingSummary publishingSummary;
    long processingTimeMs;

    public static WebhookResponse from(WebhookProcessingResult result) {
        WebhookProcessingResult.PublishingSummary ps = result.getPublishingSummary();
        return WebhookResponse.builder()
                .status(result.getStatus())
                .message(result.getMessage())
                .receiver(result.getReceiver())
                .alertResults(result.getAlertResults().stream().map(AlertResult::from).collect(Collectors.toList()))
                .summary(result.getSummary())
                .publishingSummary(PublishingSummary.builder()
                        .totalTargets(ps.getTotalTargets())
                        .successfulPublishes(ps.getSuccessfulPublishes())
                        .failedPublishes(ps.getFailedPublishes())
                        .mode(ps.getMode())
                        .enabledTargets(ps.getEnabledTargets())
                        .build())
                .processingTimeMs(result.getProcessingTimeMs())
                .build();
    }

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class AlertResult {
        String fingerprint;
        String alertName;
        AlertOutcome status;
        Classification classification;
        FilterInfo filter;
        List<PublishResultDto> publishResults;
        String error;
        long processingTimeMs;

        static AlertResult from(AlertProcessingResult result) {
            return AlertResult.builder()
                    .fingerprint(result.getFingerprint())
                    .alertName(result.getAlertName())
                    .status(result.getOutcome())
                    .classification(result.getClassification())
                    .filter(FilterInfo.from(result.getFilterDecision()))
                    .publishResults(result.getPublishResults().stream()
                            .map(PublishResultDto::from).collect(Collectors.toList()))
                    .error(result.getError())
                    .processingTimeMs(result.getProcessingTimeMs())
                    .build();
        }
    }

    @Value
    @Builder
    public static class FilterInfo {
        FilterAction action;
        String reason;
        String rule;
        String error;

        static FilterInfo from(FilterDecision decision) {
            if (decision == null) {
                return null;
            }
            return FilterInfo.builder()
                    .action(decision.getAction())
                    .reason(decision.getReason())
                    .rule(decision.getRuleName())
                    .error(decision.getError())
                    .build();
        }
    }

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PublishingSummary {
        int totalTargets;
        int successfulPublishes;
        int failedPublishes;
        PublishingMode mode;
        int enabledTargets;
    }
}
