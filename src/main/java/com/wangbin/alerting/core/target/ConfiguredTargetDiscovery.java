package com.wangbin.alerting.core.target;

import com.wangbin.alerting.common.domain.entity.Target;
import com.wangbin.alerting.core.publish.config.PublishingProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 从 alerting.publishing.targets 读取目标
 */
@Component
public class ConfiguredTargetDiscovery implements TargetDiscovery {

    private final PublishingProperties properties;

    public ConfiguredTargetDiscovery(PublishingProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<Target> listTargets() {
        List<Target> targets = new ArrayList<>();
        for (PublishingProperties.TargetConfig config : properties.getTargets()) {
            targets.add(Target.builder()
                    .name(config.getName())
                    .type(config.getType())
                    .enabled(config.isEnabled())
                    .url(config.getUrl())
                    .headers(config.getHeaders() == null ? Map.of() : Map.copyOf(config.getHeaders()))
                    .build());
        }
        return targets;
    }
}
