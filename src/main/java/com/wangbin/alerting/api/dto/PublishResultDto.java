package com.wangbin.alerting.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.wangbin.alerting.common.domain.entity.PublishResult;
import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PublishResultDto {

    String targetName;
    String targetType;
    boolean success;
    int statusCode;
    PublishErrorCode errorCode;
    String errorMessage;
    int retryCount;
    long durationMs;

    public static PublishResultDto from(PublishResult result) {
        return PublishResultDto.builder()
                .targetName(result.getTargetName())
                .targetType(result.getTargetType())
                .success(result.isSuccess())
                .statusCode(result.getStatusCode())
                .errorCode(result.getErrorCode())
                .errorMessage(result.getErrorMessage())
                .retryCount(result.getRetryCount())
                .durationMs(result.getDurationMs())
                .build();
    }
}
