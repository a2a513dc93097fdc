package com.wangbin.alerting.core.filter;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.FilterDecision;
import com.wangbin.alerting.core.filter.config.FilterProperties;
import com.wangbin.alerting.core.filter.rule.FilterRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 过滤引擎
 *
 * 规则按配置顺序执行，第一条拒绝规则生效；无规则拒绝则放行。
 * 规则执行异常时按 fail-open 配置放行（默认）或拒绝，并在决策中附带错误信息。
 */
@Slf4j
@Component
public class FilterEngine {

    private final List<FilterRule> rules;
    private final boolean failOpen;
    private final Clock clock;

    @Autowired
    public FilterEngine(FilterProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public FilterEngine(FilterProperties properties, Clock clock) {
        this(FilterRuleFactory.build(properties.getRules()), properties.isFailOpen(), clock);
    }

    public FilterEngine(List<FilterRule> rules, boolean failOpen, Clock clock) {
        this.rules = List.copyOf(rules);
        this.failOpen = failOpen;
        this.clock = clock;
        log.info("过滤引擎初始化完成: 规则数={}, failOpen={}", this.rules.size(), failOpen);
    }

    public FilterDecision evaluate(Alert alert, Classification classification) {
        Instant now = clock.instant();
        for (FilterRule rule : rules) {
            String denyReason;
            try {
                denyReason = rule.evaluate(alert, classification, now);
            } catch (RuntimeException e) {
                log.error("过滤规则执行异常: rule={}, fingerprint={}, failOpen={}",
                        rule.getName(), alert.getFingerprint(), failOpen, e);
                String error = e.getClass().getSimpleName() + ": " + e.getMessage();
                return failOpen ? FilterDecision.failOpen(rule.getName(), error)
                        : FilterDecision.failClosed(rule.getName(), error);
            }
            if (denyReason != null) {
                log.debug("告警被过滤: fingerprint={}, rule={}, reason={}",
                        alert.getFingerprint(), rule.getName(), denyReason);
                return FilterDecision.deny(rule.getName(), denyReason);
            }
        }
        return FilterDecision.allow(rules.isEmpty() ? "未配置过滤规则" : "所有规则均放行");
    }

    public List<FilterRule> getRules() {
        return rules;
    }
}
