package com.wangbin.alerting.support;

import com.wangbin.alerting.common.domain.entity.Target;
import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import com.wangbin.alerting.core.publish.sender.TargetDeliveryException;
import com.wangbin.alerting.core.publish.sender.TargetSender;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 按目标名称预设响应状态与延迟的发送器
 */
public class ScriptedSender implements TargetSender {

    private final Map<String, Integer> statusByTarget = new ConcurrentHashMap<>();
    private final Map<String, Long> delayByTarget = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final List<String> payloads = new CopyOnWriteArrayList<>();

    public ScriptedSender respond(String targetName, int status) {
        statusByTarget.put(targetName, status);
        return this;
    }

    public ScriptedSender delay(String targetName, long millis) {
        delayByTarget.put(targetName, millis);
        return this;
    }

    public int calls(String targetName) {
        AtomicInteger count = calls.get(targetName);
        return count == null ? 0 : count.get();
    }

    public List<String> payloads() {
        return payloads;
    }

    @Override
    public int send(Target target, String payload, Duration timeout) throws TargetDeliveryException {
        calls.computeIfAbsent(target.getName(), k -> new AtomicInteger()).incrementAndGet();
        payloads.add(payload);
        long delay = delayByTarget.getOrDefault(target.getName(), 0L);
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TargetDeliveryException(PublishErrorCode.TIMEOUT, 0, "interrupted");
            }
        }
        int status = statusByTarget.getOrDefault(target.getName(), 200);
        if (status >= 300) {
            throw TargetDeliveryException.ofStatus(status, "status " + status);
        }
        return status;
    }
}
