package com.wangbin.alerting.core.filter.rule;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.enums.ClassificationSource;
import lombok.Getter;

import java.time.Instant;
import java.util.Set;

/**
 * 置信度下限规则，可限定只作用于特定分类来源
 */
@Getter
public class ConfidenceRule implements FilterRule {

    private final String name;
    private final double minConfidence;
    private final Set<ClassificationSource> sources;

    public ConfidenceRule(String name, double minConfidence, Set<ClassificationSource> sources) {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("置信度下限必须在[0,1]之间: " + minConfidence);
        }
        this.name = name;
        this.minConfidence = minConfidence;
        this.sources = Set.copyOf(sources);
    }

    @Override
    public FilterRuleType getType() {
        return FilterRuleType.CONFIDENCE;
    }

    @Override
    public String evaluate(Alert alert, Classification classification, Instant now) {
        if (!sources.isEmpty() && !sources.contains(classification.getSource())) {
            return null;
        }
        if (classification.getConfidence() < minConfidence) {
            return String.format("置信度 %.2f 低于下限 %.2f", classification.getConfidence(), minConfidence);
        }
        return null;
    }
}
