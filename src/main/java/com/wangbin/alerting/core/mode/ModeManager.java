package com.wangbin.alerting.core.mode;

import com.wangbin.alerting.common.domain.enums.PublishingMode;
import com.wangbin.alerting.core.publish.config.PublishingProperties;
import com.wangbin.alerting.core.target.TargetRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 发布模式管理器
 *
 * 两状态机 NORMAL / METRICS_ONLY，按固定节拍轮询目标注册表，避免目标抖动引起频繁切换。
 * evaluate 是唯一写入方；读取方只读取 volatile 快照，不加锁、不分配对象。
 */
@Slf4j
@Component
public class ModeManager {

    private final TargetRegistry registry;
    private final Clock clock;
    private final int historySize;

    private volatile ModeSnapshot snapshot;

    @Autowired
    public ModeManager(TargetRegistry registry, PublishingProperties properties) {
        this(registry, properties.getModeHistorySize(), Clock.systemUTC());
    }

    public ModeManager(TargetRegistry registry, int historySize, Clock clock) {
        this.registry = registry;
        this.clock = clock;
        this.historySize = Math.max(1, historySize);

        // 初始状态取自第一次读取注册表
        int enabled = registry.enabledCount();
        Instant now = clock.instant();
        this.snapshot = ModeSnapshot.builder()
                .mode(enabled > 0 ? PublishingMode.NORMAL : PublishingMode.METRICS_ONLY)
                .enabledTargets(enabled)
                .transitionCount(0)
                .currentModeSince(now)
                .lastTransitionReason(ModeSnapshot.REASON_INITIAL)
                .lastTransitionTime(now)
                .lastEvaluationTime(now)
                .history(List.of())
                .build();
        log.info("发布模式初始化: mode={}, enabledTargets={}", snapshot.getMode(), enabled);
    }

    /**
     * 按节拍重新计算模式
     */
    @Scheduled(fixedDelayString = "${alerting.publishing.mode-check-interval-ms:1000}")
    public synchronized void evaluate() {
        int enabled = registry.enabledCount();
        Instant now = clock.instant();
        ModeSnapshot current = snapshot;

        PublishingMode target = null;
        String reason = null;
        if (enabled > 0 && current.getMode() == PublishingMode.METRICS_ONLY) {
            target = PublishingMode.NORMAL;
            reason = ModeSnapshot.REASON_TARGETS_AVAILABLE;
        } else if (enabled == 0 && current.getMode() == PublishingMode.NORMAL) {
            target = PublishingMode.METRICS_ONLY;
            reason = ModeSnapshot.REASON_NO_ENABLED_TARGETS;
        }

        if (target == null) {
            snapshot = current.toBuilder().enabledTargets(enabled).lastEvaluationTime(now).build();
            return;
        }

        ModeTransition transition = new ModeTransition(current.getMode(), target, reason, enabled, now);
        List<ModeTransition> history = new ArrayList<>(current.getHistory());
        history.add(transition);
        while (history.size() > historySize) {
            history.remove(0);
        }

        snapshot = current.toBuilder()
                .mode(target)
                .enabledTargets(enabled)
                .transitionCount(current.getTransitionCount() + 1)
                .currentModeSince(now)
                .lastTransitionReason(reason)
                .lastTransitionTime(now)
                .lastEvaluationTime(now)
                .history(List.copyOf(history))
                .build();

        log.info("发布模式切换: {} -> {}, reason={}, enabledTargets={}",
                transition.from(), transition.to(), reason, enabled);
    }

    public PublishingMode getCurrentMode() {
        return snapshot.getMode();
    }

    public ModeSnapshot getModeMetrics() {
        return snapshot;
    }

    public boolean isMetricsOnly() {
        return snapshot.isMetricsOnly();
    }

    public Instant now() {
        return clock.instant();
    }
}
