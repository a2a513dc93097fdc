package com.wangbin.alerting.core.filter.rule;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.enums.Severity;
import lombok.Getter;

import java.time.Instant;
import java.util.Set;

/**
 * 严重级别白名单/黑名单
 */
@Getter
public class SeverityRule implements FilterRule {

    private final String name;
    private final Set<Severity> allow;
    private final Set<Severity> deny;

    public SeverityRule(String name, Set<Severity> allow, Set<Severity> deny) {
        this.name = name;
        this.allow = Set.copyOf(allow);
        this.deny = Set.copyOf(deny);
    }

    @Override
    public FilterRuleType getType() {
        return FilterRuleType.SEVERITY;
    }

    @Override
    public String evaluate(Alert alert, Classification classification, Instant now) {
        Severity severity = classification.getSeverity();
        if (deny.contains(severity)) {
            return "严重级别 " + severity.getCode() + " 在拒绝列表中";
        }
        if (!allow.isEmpty() && !allow.contains(severity)) {
            return "严重级别 " + severity.getCode() + " 不在允许列表中";
        }
        return null;
    }
}
