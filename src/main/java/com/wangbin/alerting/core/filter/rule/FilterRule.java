package com.wangbin.alerting.core.filter.rule;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;

import java.time.Instant;

/**
 * 过滤规则，实现必须是输入的纯函数
 */
public interface FilterRule {

    String getName();

    FilterRuleType getType();

    /**
     * 评估规则
     *
     * @param now 评估时刻，只有时间窗口规则使用
     * @return 拒绝原因；规则不拒绝时返回null
     */
    String evaluate(Alert alert, Classification classification, Instant now);
}
