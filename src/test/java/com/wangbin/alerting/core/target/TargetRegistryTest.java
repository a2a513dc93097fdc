package com.wangbin.alerting.core.target;

import com.wangbin.alerting.common.domain.entity.Target;
import com.wangbin.alerting.core.publish.config.PublishingProperties;
import com.wangbin.alerting.support.TestAlerts;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TargetRegistryTest {

    @Test
    void initialSnapshotIsLoadedAtConstruction() {
        TargetRegistry registry = new TargetRegistry(() -> List.of(TestAlerts.target("a"), TestAlerts.target("b")));

        assertEquals(2, registry.snapshot().size());
        assertEquals(2, registry.enabledCount());
        assertTrue(registry.find("a").isPresent());
        assertFalse(registry.find("zzz").isPresent());
    }

    @Test
    void invalidAndDuplicateTargetsAreDropped() {
        Target noType = Target.builder().name("no-type").enabled(true).build();
        Target noName = Target.builder().type("slack").enabled(true).build();
        TargetRegistry registry = new TargetRegistry(() -> List.of(
                TestAlerts.target("a"), TestAlerts.target("a", "slack"), noType, noName));

        assertEquals(1, registry.snapshot().size());
        assertEquals("webhook", registry.snapshot().get(0).getType());
    }

    @Test
    void enabledTargetsExcludesDisabledOnes() {
        Target disabled = TestAlerts.target("off").toBuilder().enabled(false).build();
        TargetRegistry registry = new TargetRegistry(() -> List.of(TestAlerts.target("on"), disabled));

        assertEquals(1, registry.enabledTargets().size());
        assertEquals("on", registry.enabledTargets().get(0).getName());
        assertEquals(2, registry.getRefreshStatus().getTotalTargets());
    }

    @Test
    void discoveryFailureKeepsPreviousSnapshot() {
        AtomicBoolean failing = new AtomicBoolean(false);
        TargetRegistry registry = new TargetRegistry(() -> {
            if (failing.get()) {
                throw new TargetDiscoveryException("secret store unreachable");
            }
            return List.of(TestAlerts.target("a"));
        });

        failing.set(true);
        assertFalse(registry.refresh());

        assertEquals(1, registry.snapshot().size());
        TargetRegistry.RefreshStatus status = registry.getRefreshStatus();
        assertEquals("secret store unreachable", status.getLastError());
        assertEquals(1, status.getFailureCount());
    }

    @Test
    void snapshotHandedOutIsStableAcrossRefresh() {
        List<Target> source = new ArrayList<>(List.of(TestAlerts.target("a")));
        TargetRegistry registry = new TargetRegistry(() -> new ArrayList<>(source));

        List<Target> taken = registry.enabledTargets();
        source.add(TestAlerts.target("b"));
        registry.refresh();

        assertEquals(1, taken.size());
        assertEquals(2, registry.enabledTargets().size());
        assertThrows(UnsupportedOperationException.class, () -> taken.add(TestAlerts.target("c")));
    }

    @Test
    void configuredDiscoveryReadsTargetsFromProperties() throws TargetDiscoveryException {
        PublishingProperties props = new PublishingProperties();
        PublishingProperties.TargetConfig slack = new PublishingProperties.TargetConfig();
        slack.setName("ops-slack");
        slack.setType("slack");
        slack.setUrl("https://hooks.slack.com/x");
        props.setTargets(List.of(slack));

        List<Target> targets = new ConfiguredTargetDiscovery(props).listTargets();

        assertEquals(1, targets.size());
        assertEquals("slack", targets.get(0).getType());
        assertTrue(targets.get(0).isEnabled());
    }
}
