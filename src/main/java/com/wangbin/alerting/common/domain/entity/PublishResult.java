package com.wangbin.alerting.common.domain.entity;

import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import lombok.Builder;
import lombok.Value;

/**
 * 单个 (告警, 目标) 的发布结果，包含全部重试
 */
@Value
@Builder
public class PublishResult {

    String targetName;
    String targetType;
    boolean success;
    int statusCode;
    PublishErrorCode errorCode;
    String errorMessage;
    int retryCount;
    long durationMs;

    public static PublishResult deadlineExceeded(Target target, long durationMs) {
        return PublishResult.builder()
                .targetName(target.getName())
                .targetType(target.getType())
                .success(false)
                .errorCode(PublishErrorCode.DEADLINE_EXCEEDED)
                .errorMessage("请求截止时间已到，发布被取消")
                .durationMs(durationMs)
                .build();
    }
}
