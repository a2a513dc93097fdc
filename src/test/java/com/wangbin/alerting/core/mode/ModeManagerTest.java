package com.wangbin.alerting.core.mode;

import com.wangbin.alerting.common.domain.entity.Target;
import com.wangbin.alerting.common.domain.enums.PublishingMode;
import com.wangbin.alerting.core.target.TargetRegistry;
import com.wangbin.alerting.support.TestAlerts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModeManagerTest {

    private final List<Target> targets = new ArrayList<>();
    private TargetRegistry registry;
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        targets.clear();
        registry = new TargetRegistry(() -> new ArrayList<>(targets));
    }

    private void setTargets(Target... list) {
        targets.clear();
        targets.addAll(List.of(list));
        registry.refresh();
    }

    @Test
    void startsInMetricsOnlyWithoutTargets() {
        ModeManager manager = new ModeManager(registry, 50, clock);

        assertEquals(PublishingMode.METRICS_ONLY, manager.getCurrentMode());
        assertTrue(manager.isMetricsOnly());
        assertEquals(0, manager.getModeMetrics().getTransitionCount());
        assertEquals(ModeSnapshot.REASON_INITIAL, manager.getModeMetrics().getLastTransitionReason());
    }

    @Test
    void startsInNormalWhenTargetsAreEnabled() {
        setTargets(TestAlerts.target("a"));
        ModeManager manager = new ModeManager(registry, 50, clock);

        assertEquals(PublishingMode.NORMAL, manager.getCurrentMode());
        assertEquals(1, manager.getModeMetrics().getEnabledTargets());
    }

    @Test
    void transitionsFollowEnabledTargetCount() {
        ModeManager manager = new ModeManager(registry, 50, clock);

        setTargets(TestAlerts.target("a"));
        manager.evaluate();
        assertEquals(PublishingMode.NORMAL, manager.getCurrentMode());
        assertEquals(ModeSnapshot.REASON_TARGETS_AVAILABLE, manager.getModeMetrics().getLastTransitionReason());

        setTargets(TestAlerts.target("a").toBuilder().enabled(false).build());
        manager.evaluate();
        assertEquals(PublishingMode.METRICS_ONLY, manager.getCurrentMode());
        assertEquals(ModeSnapshot.REASON_NO_ENABLED_TARGETS, manager.getModeMetrics().getLastTransitionReason());

        assertEquals(2, manager.getModeMetrics().getTransitionCount());
        List<ModeTransition> history = manager.getModeMetrics().getHistory();
        assertEquals(2, history.size());
        assertEquals(PublishingMode.METRICS_ONLY, history.get(0).from());
        assertEquals(PublishingMode.NORMAL, history.get(1).from());
    }

    @Test
    void evaluateWithoutChangeOnlyRefreshesCount() {
        setTargets(TestAlerts.target("a"));
        ModeManager manager = new ModeManager(registry, 50, clock);

        setTargets(TestAlerts.target("a"), TestAlerts.target("b"));
        manager.evaluate();

        assertEquals(PublishingMode.NORMAL, manager.getCurrentMode());
        assertEquals(2, manager.getModeMetrics().getEnabledTargets());
        assertEquals(0, manager.getModeMetrics().getTransitionCount());
    }

    @Test
    void historyIsBoundedAndCountNeverDecreases() {
        ModeManager manager = new ModeManager(registry, 3, clock);
        long previous = 0;
        for (int i = 0; i < 10; i++) {
            if (i % 2 == 0) {
                setTargets(TestAlerts.target("a"));
            } else {
                setTargets();
            }
            manager.evaluate();
            long count = manager.getModeMetrics().getTransitionCount();
            assertTrue(count >= previous);
            previous = count;
        }

        assertEquals(10, manager.getModeMetrics().getTransitionCount());
        assertEquals(3, manager.getModeMetrics().getHistory().size());
    }
}
