package com.wangbin.alerting.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.wangbin.alerting.common.domain.enums.PublishingMode;
import com.wangbin.alerting.core.mode.ModeSnapshot;
import com.wangbin.alerting.core.mode.ModeTransition;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 发布模式查询响应
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ModeResponse {

    PublishingMode mode;
    int enabledTargets;
    long transitionCount;
    double currentModeDurationSeconds;
    Instant currentModeSince;
    String lastTransitionReason;
    Instant lastTransitionTime;

    public static ModeResponse from(ModeSnapshot snapshot, Instant now) {
        return ModeResponse.builder()
                .mode(snapshot.getMode())
                .enabledTargets(snapshot.getEnabledTargets())
                .transitionCount(snapshot.getTransitionCount())
                .currentModeDurationSeconds(snapshot.currentModeDuration(now).toMillis() / 1000.0)
                .currentModeSince(snapshot.getCurrentModeSince())
                .lastTransitionReason(snapshot.getLastTransitionReason())
                .lastTransitionTime(snapshot.getLastTransitionTime())
                .build();
    }

    @Value
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Transition {
        PublishingMode from;
        PublishingMode to;
        String reason;
        int enabledTargets;
        Instant timestamp;

        public static List<Transition> fromHistory(List<ModeTransition> history) {
            return history.stream()
                    .map(t -> Transition.builder()
                            .from(t.from())
                            .to(t.to())
                            .reason(t.reason())
                            .enabledTargets(t.enabledTargets())
                            .timestamp(t.timestamp())
                            .build())
                    .collect(Collectors.toList());
        }
    }
}
