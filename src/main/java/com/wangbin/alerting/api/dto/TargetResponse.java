package com.wangbin.alerting.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.wangbin.alerting.common.domain.entity.Target;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 目标信息，头部只列出名称
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TargetResponse {

    String name;
    String type;
    boolean enabled;
    String url;
    List<String> headerNames;

    public static TargetResponse from(Target target) {
        return TargetResponse.builder()
                .name(target.getName())
                .type(target.getType())
                .enabled(target.isEnabled())
                .url(target.getUrl())
                .headerNames(new ArrayList<>(target.getHeaders().keySet()))
                .build();
    }
}
