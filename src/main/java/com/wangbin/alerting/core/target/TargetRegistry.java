package com.wangbin.alerting.core.target;

import com.wangbin.alerting.common.domain.entity.Target;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 目标注册表
 *
 * 持有不可变的目标快照，刷新时整体替换。发布方每次请求取一次快照，
 * 请求期间注册表变化不会影响已取出的列表。发现失败时保留旧快照。
 */
@Slf4j
@Component
public class TargetRegistry {

    private final TargetDiscovery discovery;

    private volatile List<Target> targets = List.of();
    private volatile Instant lastRefreshTime;
    private volatile Instant lastSuccessTime;
    private volatile String lastError;

    private final AtomicLong refreshCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);

    public TargetRegistry(TargetDiscovery discovery) {
        this.discovery = discovery;
        refresh();
    }

    /**
     * 从发现组件重新加载目标
     *
     * @return 刷新是否成功
     */
    @Scheduled(fixedDelayString = "${alerting.publishing.refresh-interval-ms:30000}",
            initialDelayString = "${alerting.publishing.refresh-interval-ms:30000}")
    public synchronized boolean refresh() {
        lastRefreshTime = Instant.now();
        refreshCount.incrementAndGet();

        List<Target> discovered;
        try {
            discovered = discovery.listTargets();
        } catch (TargetDiscoveryException | RuntimeException e) {
            failureCount.incrementAndGet();
            lastError = e.getMessage();
            log.warn("目标发现失败，保留旧快照({}个目标): {}", targets.size(), e.getMessage());
            return false;
        }

        List<Target> accepted = sanitize(discovered == null ? List.of() : discovered);
        List<Target> previous = targets;
        targets = List.copyOf(accepted);
        lastSuccessTime = lastRefreshTime;
        lastError = null;

        if (!previous.equals(targets)) {
            log.info("目标列表已更新: 总数={}, 启用={}", targets.size(), countEnabled(targets));
        }
        return true;
    }

    /**
     * 当前全部目标快照
     */
    public List<Target> snapshot() {
        return targets;
    }

    /**
     * 当前启用的目标快照
     */
    public List<Target> enabledTargets() {
        return targets.stream().filter(Target::isEnabled).collect(Collectors.toUnmodifiableList());
    }

    public int enabledCount() {
        return countEnabled(targets);
    }

    public Optional<Target> find(String name) {
        return targets.stream().filter(t -> t.getName().equals(name)).findFirst();
    }

    public RefreshStatus getRefreshStatus() {
        List<Target> current = targets;
        return RefreshStatus.builder()
                .totalTargets(current.size())
                .enabledTargets(countEnabled(current))
                .lastRefreshTime(lastRefreshTime)
                .lastSuccessTime(lastSuccessTime)
                .lastError(lastError)
                .refreshCount(refreshCount.get())
                .failureCount(failureCount.get())
                .build();
    }

    private List<Target> sanitize(List<Target> discovered) {
        List<Target> accepted = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Target target : discovered) {
            if (target == null || target.getName() == null || target.getName().isBlank()) {
                log.warn("忽略无名称的目标: {}", target);
                continue;
            }
            if (target.getType() == null || target.getType().isBlank()) {
                log.warn("忽略缺少类型的目标: {}", target.getName());
                continue;
            }
            if (!names.add(target.getName())) {
                log.warn("忽略重名目标: {}", target.getName());
                continue;
            }
            accepted.add(target);
        }
        return accepted;
    }

    private static int countEnabled(List<Target> list) {
        int count = 0;
        for (Target target : list) {
            if (target.isEnabled()) {
                count++;
            }
        }
        return count;
    }

    @Value
    @Builder
    public static class RefreshStatus {
        int totalTargets;
        int enabledTargets;
        Instant lastRefreshTime;
        Instant lastSuccessTime;
        String lastError;
        long refreshCount;
        long failureCount;
    }
}
