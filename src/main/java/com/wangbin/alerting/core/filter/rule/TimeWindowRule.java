package com.wangbin.alerting.core.filter.rule;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.enums.Severity;
import lombok.Getter;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Set;

/**
 * 工作时间窗口规则：窗口外拒绝非豁免级别的告警
 *
 * end 早于 start 时视为跨午夜窗口。
 */
@Getter
public class TimeWindowRule implements FilterRule {

    private final String name;
    private final LocalTime start;
    private final LocalTime end;
    private final Set<DayOfWeek> days;
    private final ZoneId zone;
    private final Set<Severity> exemptSeverities;

    public TimeWindowRule(String name, LocalTime start, LocalTime end, Set<DayOfWeek> days,
                          ZoneId zone, Set<Severity> exemptSeverities) {
        this.name = name;
        this.start = start;
        this.end = end;
        this.days = Set.copyOf(days);
        this.zone = zone;
        this.exemptSeverities = Set.copyOf(exemptSeverities);
    }

    @Override
    public FilterRuleType getType() {
        return FilterRuleType.TIME_WINDOW;
    }

    @Override
    public String evaluate(Alert alert, Classification classification, Instant now) {
        if (exemptSeverities.contains(classification.getSeverity())) {
            return null;
        }
        ZonedDateTime local = now.atZone(zone);
        if (isWithinWindow(local)) {
            return null;
        }
        return "工作时间窗口外 (" + start + "-" + end + " " + zone + ")，级别 "
                + classification.getSeverity().getCode() + " 不豁免";
    }

    boolean isWithinWindow(ZonedDateTime local) {
        LocalTime time = local.toLocalTime();
        if (!end.isBefore(start)) {
            return days.contains(local.getDayOfWeek()) && !time.isBefore(start) && time.isBefore(end);
        }
        // 跨午夜：凌晨部分归属前一天的窗口
        if (!time.isBefore(start)) {
            return days.contains(local.getDayOfWeek());
        }
        if (time.isBefore(end)) {
            return days.contains(local.getDayOfWeek().minus(1));
        }
        return false;
    }
}
