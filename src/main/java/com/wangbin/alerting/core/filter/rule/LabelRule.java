package com.wangbin.alerting.core.filter.rule;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 标签匹配规则，所有匹配器同时满足时拒绝
 */
@Getter
public class LabelRule implements FilterRule {

    private final String name;
    private final List<Matcher> matchers;

    public LabelRule(String name, List<Matcher> matchers) {
        if (matchers.isEmpty()) {
            throw new IllegalArgumentException("标签规则至少需要一个匹配器: " + name);
        }
        this.name = name;
        this.matchers = List.copyOf(matchers);
    }

    @Override
    public FilterRuleType getType() {
        return FilterRuleType.LABEL;
    }

    @Override
    public String evaluate(Alert alert, Classification classification, Instant now) {
        for (Matcher matcher : matchers) {
            if (!matcher.matches(alert.label(matcher.label()))) {
                return null;
            }
        }
        return "标签匹配拒绝规则: " + matchers.stream().map(Matcher::toString)
                .collect(Collectors.joining(", "));
    }

    /**
     * 单个标签匹配器，value 与 pattern 二选一
     */
    public record Matcher(String label, String value, Pattern pattern, boolean negate) {

        public boolean matches(String actual) {
            boolean matched;
            if (actual == null) {
                matched = false;
            } else if (pattern != null) {
                matched = pattern.matcher(actual).matches();
            } else {
                matched = actual.equals(value);
            }
            return negate != matched;
        }

        @Override
        public String toString() {
            String op = pattern != null ? (negate ? "!~" : "=~") : (negate ? "!=" : "=");
            return label + op + (pattern != null ? pattern.pattern() : value);
        }
    }
}
