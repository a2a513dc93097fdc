package com.wangbin.alerting.common.domain.entity;

import com.wangbin.alerting.common.domain.enums.FilterAction;
import lombok.Value;

/**
 * 过滤决策，每个请求每条告警重新计算，不持久化
 */
@Value
public class FilterDecision {

    FilterAction action;
    String reason;
    /** 产生拒绝的规则名，放行时为null */
    String ruleName;
    /** 规则执行异常时的错误信息（fail-open 场景） */
    String error;

    public static FilterDecision allow(String reason) {
        return new FilterDecision(FilterAction.ALLOW, reason, null, null);
    }

    public static FilterDecision deny(String ruleName, String reason) {
        return new FilterDecision(FilterAction.DENY, reason, ruleName, null);
    }

    public static FilterDecision failOpen(String ruleName, String error) {
        return new FilterDecision(FilterAction.ALLOW, "规则执行异常，默认放行", ruleName, error);
    }

    public static FilterDecision failClosed(String ruleName, String error) {
        return new FilterDecision(FilterAction.DENY, "规则执行异常，默认拒绝", ruleName, error);
    }

    public boolean isAllowed() {
        return action == FilterAction.ALLOW;
    }

    public boolean hasError() {
        return error != null;
    }
}
