package com.wangbin.alerting.core.filter;

import com.wangbin.alerting.common.domain.enums.ClassificationSource;
import com.wangbin.alerting.common.domain.enums.Severity;
import com.wangbin.alerting.common.exception.BusinessException;
import com.wangbin.alerting.common.web.result.ResultCode;
import com.wangbin.alerting.core.filter.config.FilterProperties;
import com.wangbin.alerting.core.filter.rule.ConfidenceRule;
import com.wangbin.alerting.core.filter.rule.FilterRule;
import com.wangbin.alerting.core.filter.rule.LabelRule;
import com.wangbin.alerting.core.filter.rule.NamespaceRule;
import com.wangbin.alerting.core.filter.rule.SeverityRule;
import com.wangbin.alerting.core.filter.rule.TimeWindowRule;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 将配置编译为规则对象（正则、通配符、时间只解析一次），配置无效时启动失败
 */
public final class FilterRuleFactory {

    private FilterRuleFactory() {
    }

    public static List<FilterRule> build(List<FilterProperties.RuleConfig> configs) {
        List<FilterRule> rules = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < configs.size(); i++) {
            FilterProperties.RuleConfig config = configs.get(i);
            if (!config.isEnabled()) {
                continue;
            }
            String name = config.getName() == null || config.getName().isBlank()
                    ? "rule-" + i : config.getName();
            if (!names.add(name)) {
                throw invalid(name, "规则名称重复");
            }
            try {
                rules.add(build(name, config));
            } catch (BusinessException e) {
                throw e;
            } catch (RuntimeException e) {
                throw invalid(name, e.getMessage());
            }
        }
        return rules;
    }

    private static FilterRule build(String name, FilterProperties.RuleConfig config) {
        if (config.getType() == null) {
            throw invalid(name, "缺少规则类型");
        }
        switch (config.getType()) {
            case SEVERITY:
                if (config.getAllowSeverities().isEmpty() && config.getDenySeverities().isEmpty()) {
                    throw invalid(name, "严重级别规则需要 allow-severities 或 deny-severities");
                }
                return new SeverityRule(name, severities(config.getAllowSeverities()),
                        severities(config.getDenySeverities()));
            case LABEL:
                List<LabelRule.Matcher> matchers = new ArrayList<>();
                for (FilterProperties.LabelMatcher m : config.getMatchers()) {
                    if (m.getName() == null || m.getName().isBlank()) {
                        throw invalid(name, "标签匹配器缺少 name");
                    }
                    if ((m.getValue() == null) == (m.getRegex() == null)) {
                        throw invalid(name, "标签匹配器 " + m.getName() + " 需要 value 或 regex 之一");
                    }
                    Pattern pattern = m.getRegex() != null ? Pattern.compile(m.getRegex()) : null;
                    matchers.add(new LabelRule.Matcher(m.getName(), m.getValue(), pattern, m.isNegate()));
                }
                return new LabelRule(name, matchers);
            case NAMESPACE:
                if (config.getInclude().isEmpty() && config.getExclude().isEmpty()) {
                    throw invalid(name, "命名空间规则需要 include 或 exclude");
                }
                return new NamespaceRule(name, config.getInclude(), config.getExclude());
            case TIME_WINDOW:
                FilterProperties.BusinessHours hours = config.getBusinessHours();
                Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
                for (String day : hours.getDays()) {
                    days.add(DayOfWeek.valueOf(day.trim().toUpperCase(Locale.ROOT)));
                }
                return new TimeWindowRule(name, LocalTime.parse(hours.getStart()),
                        LocalTime.parse(hours.getEnd()), days, ZoneId.of(hours.getZone()),
                        severities(config.getExemptSeverities()));
            case CONFIDENCE:
                if (config.getMinConfidence() == null) {
                    throw invalid(name, "置信度规则缺少 min-confidence");
                }
                Set<ClassificationSource> sources = EnumSet.noneOf(ClassificationSource.class);
                for (String source : config.getSources()) {
                    sources.add(ClassificationSource.fromCode(source.trim()));
                }
                return new ConfidenceRule(name, config.getMinConfidence(), sources);
            default:
                throw invalid(name, "不支持的规则类型: " + config.getType());
        }
    }

    private static Set<Severity> severities(List<String> codes) {
        Set<Severity> result = EnumSet.noneOf(Severity.class);
        for (String code : codes) {
            Severity severity = Severity.fromCode(code);
            if (severity == Severity.UNKNOWN && !"unknown".equalsIgnoreCase(code.trim())) {
                throw new IllegalArgumentException("未知的严重级别: " + code);
            }
            result.add(severity);
        }
        return result;
    }

    private static BusinessException invalid(String name, String message) {
        return new BusinessException(ResultCode.CONFIG_INVALID, "过滤规则配置无效 [" + name + "]: " + message);
    }
}
