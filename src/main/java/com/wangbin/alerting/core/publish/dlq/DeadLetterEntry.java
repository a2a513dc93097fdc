package com.wangbin.alerting.core.publish.dlq;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 死信记录：投递最终失败的 (告警, 目标, 载荷)
 */
@Value
@Builder(toBuilder = true)
public class DeadLetterEntry {

    String id;
    String fingerprint;
    String targetName;
    String targetType;
    Alert alert;
    Classification classification;
    /** 失败时的载荷JSON */
    String payload;
    String errorMessage;
    PublishErrorCode errorCode;
    int retryCount;
    Instant failedAt;
    int replayCount;
    Instant lastReplayAt;
}
