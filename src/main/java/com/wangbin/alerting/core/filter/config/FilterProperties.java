package com.wangbin.alerting.core.filter.config;

import com.wangbin.alerting.core.filter.rule.FilterRuleType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 过滤规则配置，规则按列表顺序执行
 */
@Data
@ConfigurationProperties(prefix = "alerting.filter")
public class FilterProperties {

    /** 规则执行异常时是否放行 */
    private boolean failOpen = true;

    private List<RuleConfig> rules = new ArrayList<>();

    @Data
    public static class RuleConfig {
        private String name;
        private FilterRuleType type;
        private boolean enabled = true;

        // SEVERITY
        private List<String> allowSeverities = new ArrayList<>();
        private List<String> denySeverities = new ArrayList<>();

        // LABEL
        private List<LabelMatcher> matchers = new ArrayList<>();

        // NAMESPACE
        private List<String> include = new ArrayList<>();
        private List<String> exclude = new ArrayList<>();

        // TIME_WINDOW
        private BusinessHours businessHours = new BusinessHours();
        private List<String> exemptSeverities = new ArrayList<>(List.of("critical"));

        // CONFIDENCE
        private Double minConfidence;
        private List<String> sources = new ArrayList<>();
    }

    @Data
    public static class LabelMatcher {
        private String name;
        /** 精确匹配值，与 regex 二选一 */
        private String value;
        /** 正则匹配（全匹配） */
        private String regex;
        private boolean negate = false;
    }

    @Data
    public static class BusinessHours {
        private String start = "09:00";
        private String end = "18:00";
        private List<String> days = new ArrayList<>(List.of("MONDAY", "TUESDAY", "WEDNESDAY", "THURSDAY", "FRIDAY"));
        private String zone = "UTC";
    }
}
