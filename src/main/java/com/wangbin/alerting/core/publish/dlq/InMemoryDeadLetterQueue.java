package com.wangbin.alerting.core.publish.dlq;

import com.wangbin.alerting.core.publish.config.PublishingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存死信队列
 *
 * 容量有界，满了淘汰最旧的记录。按插入顺序保存。
 */
@Slf4j
@Component
public class InMemoryDeadLetterQueue implements DeadLetterQueue {

    private final int maxSize;

    // id -> entry，按插入顺序
    private final LinkedHashMap<String, DeadLetterEntry> entries = new LinkedHashMap<>();

    private final AtomicLong totalAdded = new AtomicLong(0);
    private final AtomicLong totalEvicted = new AtomicLong(0);
    private final AtomicLong totalRemoved = new AtomicLong(0);
    private final AtomicLong totalPurged = new AtomicLong(0);

    @Autowired
    public InMemoryDeadLetterQueue(PublishingProperties properties) {
        this(properties.getDlq().getMaxSize());
    }

    public InMemoryDeadLetterQueue(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("死信队列容量必须大于0: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    @Override
    public synchronized void submit(DeadLetterEntry entry) {
        entries.put(entry.getId(), entry);
        totalAdded.incrementAndGet();

        while (entries.size() > maxSize) {
            Iterator<Map.Entry<String, DeadLetterEntry>> it = entries.entrySet().iterator();
            DeadLetterEntry evicted = it.next().getValue();
            it.remove();
            totalEvicted.incrementAndGet();
            log.error("死信队列已满({})，淘汰最旧记录: id={}, target={}",
                    maxSize, evicted.getId(), evicted.getTargetName());
        }
        log.debug("死信入队: id={}, target={}, fingerprint={}",
                entry.getId(), entry.getTargetName(), entry.getFingerprint());
    }

    @Override
    public synchronized List<DeadLetterEntry> list(String targetName, int limit) {
        List<DeadLetterEntry> all = new ArrayList<>(entries.values());
        List<DeadLetterEntry> result = new ArrayList<>();
        for (int i = all.size() - 1; i >= 0 && result.size() < limit; i--) {
            DeadLetterEntry entry = all.get(i);
            if (targetName == null || targetName.isEmpty() || targetName.equals(entry.getTargetName())) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public synchronized Optional<DeadLetterEntry> get(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public synchronized void update(DeadLetterEntry entry) {
        entries.computeIfPresent(entry.getId(), (id, old) -> entry);
    }

    @Override
    public synchronized boolean remove(String id) {
        boolean removed = entries.remove(id) != null;
        if (removed) {
            totalRemoved.incrementAndGet();
        }
        return removed;
    }

    @Override
    public synchronized int purgeOlderThan(Instant cutoff) {
        int purged = 0;
        Iterator<DeadLetterEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            DeadLetterEntry entry = it.next();
            if (entry.getFailedAt() != null && entry.getFailedAt().isBefore(cutoff)) {
                it.remove();
                purged++;
            }
        }
        totalPurged.addAndGet(purged);
        return purged;
    }

    @Override
    public synchronized int clear() {
        int size = entries.size();
        entries.clear();
        totalRemoved.addAndGet(size);
        return size;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized DeadLetterStats getStats() {
        Map<String, Integer> byTarget = new TreeMap<>();
        Instant oldest = null;
        for (DeadLetterEntry entry : entries.values()) {
            byTarget.merge(entry.getTargetName(), 1, Integer::sum);
            if (entry.getFailedAt() != null && (oldest == null || entry.getFailedAt().isBefore(oldest))) {
                oldest = entry.getFailedAt();
            }
        }
        return DeadLetterStats.builder()
                .size(entries.size())
                .maxSize(maxSize)
                .totalAdded(totalAdded.get())
                .totalEvicted(totalEvicted.get())
                .totalRemoved(totalRemoved.get())
                .totalPurged(totalPurged.get())
                .byTarget(byTarget)
                .oldestFailedAt(oldest)
                .build();
    }
}
