package com.wangbin.alerting.core.filter.rule;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 命名空间 include/exclude 通配规则（支持 * 与 ?）
 *
 * 没有 namespace 标签的告警（集群级告警）不受此规则约束。
 */
@Getter
public class NamespaceRule implements FilterRule {

    private final String name;
    private final List<Pattern> include;
    private final List<Pattern> exclude;

    public NamespaceRule(String name, List<String> includeGlobs, List<String> excludeGlobs) {
        this.name = name;
        this.include = includeGlobs.stream().map(NamespaceRule::globToPattern).collect(Collectors.toList());
        this.exclude = excludeGlobs.stream().map(NamespaceRule::globToPattern).collect(Collectors.toList());
    }

    @Override
    public FilterRuleType getType() {
        return FilterRuleType.NAMESPACE;
    }

    @Override
    public String evaluate(Alert alert, Classification classification, Instant now) {
        String namespace = alert.namespace();
        if (namespace == null || namespace.isEmpty()) {
            return null;
        }
        for (Pattern pattern : exclude) {
            if (pattern.matcher(namespace).matches()) {
                return "命名空间 " + namespace + " 被排除";
            }
        }
        if (!include.isEmpty() && include.stream().noneMatch(p -> p.matcher(namespace).matches())) {
            return "命名空间 " + namespace + " 不在包含列表中";
        }
        return null;
    }

    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }
}
