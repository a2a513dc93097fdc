package com.wangbin.alerting.common.utils;

import java.time.Duration;

/**
 * 请求截止时间，从顶层请求逐级传递到分类和发布调用
 */
public final class Deadline {

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline after(Duration timeout) {
        return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    public static Deadline afterMillis(long millis) {
        return after(Duration.ofMillis(millis));
    }

    public long remainingMillis() {
        long remaining = deadlineNanos - System.nanoTime();
        return remaining <= 0 ? 0 : Math.max(1, remaining / 1_000_000L);
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    /**
     * 取单次调用超时与剩余时间中的较小者
     */
    public long boundedMillis(long timeoutMillis) {
        return Math.min(timeoutMillis, remainingMillis());
    }

    @Override
    public String toString() {
        return "Deadline[remaining=" + remainingMillis() + "ms]";
    }
}
