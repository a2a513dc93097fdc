package com.wangbin.alerting.core.storage;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.core.processor.config.WebhookProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 内存告警存储，只保留最近的N条
 */
@Slf4j
@Component
public class InMemoryAlertStorage implements AlertStorage {

    private final int capacity;
    private final Deque<Alert> alerts = new ArrayDeque<>();

    @Autowired
    public InMemoryAlertStorage(WebhookProperties properties) {
        this(properties.getHistorySize());
    }

    public InMemoryAlertStorage(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public synchronized void store(Alert alert) {
        alerts.addFirst(alert);
        while (alerts.size() > capacity) {
            alerts.removeLast();
        }
        log.trace("告警已保存: fingerprint={}", alert.getFingerprint());
    }

    @Override
    public synchronized List<Alert> recent(int limit) {
        List<Alert> result = new ArrayList<>(Math.min(limit, alerts.size()));
        Iterator<Alert> it = alerts.iterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    @Override
    public synchronized int size() {
        return alerts.size();
    }
}
