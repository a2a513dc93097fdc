package com.wangbin.alerting.common.domain.entity;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 发布目标
 */
@Value
@Builder(toBuilder = true)
public class Target {

    /** 唯一名称 */
    String name;
    /** 格式类型: slack / pagerduty / rootly / alertmanager / webhook */
    String type;
    boolean enabled;
    /** 目标端点，对核心流程透明 */
    String url;
    Map<String, String> headers;

    public Map<String, String> getHeaders() {
        return headers == null ? Map.of() : headers;
    }
}
