package com.wangbin.alerting.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import com.wangbin.alerting.core.publish.dlq.DeadLetterEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DeadLetterResponse {

    String id;
    String fingerprint;
    String alertName;
    String targetName;
    String targetType;
    PublishErrorCode errorCode;
    String errorMessage;
    int retryCount;
    Instant failedAt;
    int replayCount;
    Instant lastReplayAt;
    String payload;

    public static DeadLetterResponse from(DeadLetterEntry entry) {
        return DeadLetterResponse.builder()
                .id(entry.getId())
                .fingerprint(entry.getFingerprint())
                .alertName(entry.getAlert() != null ? entry.getAlert().alertName() : null)
                .targetName(entry.getTargetName())
                .targetType(entry.getTargetType())
                .errorCode(entry.getErrorCode())
                .errorMessage(entry.getErrorMessage())
                .retryCount(entry.getRetryCount())
                .failedAt(entry.getFailedAt())
                .replayCount(entry.getReplayCount())
                .lastReplayAt(entry.getLastReplayAt())
                .payload(entry.getPayload())
                .build();
    }
}
