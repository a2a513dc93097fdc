package com.wangbin.alerting.core.filter.rule;

/**
 * 过滤规则类型
 */
public enum FilterRuleType {
    SEVERITY,
    LABEL,
    NAMESPACE,
    TIME_WINDOW,
    CONFIDENCE
}
