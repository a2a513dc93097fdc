package com.wangbin.alerting.core.mode;

import com.wangbin.alerting.common.domain.enums.PublishingMode;

import java.time.Instant;

/**
 * 一次模式切换记录
 */
public record ModeTransition(PublishingMode from, PublishingMode to, String reason,
                             int enabledTargets, Instant timestamp) {
}
