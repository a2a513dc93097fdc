package com.wangbin.alerting.core.publish.dlq;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 死信队列，保存投递最终失败的记录以便离线重放
 */
public interface DeadLetterQueue {

    void submit(DeadLetterEntry entry);

    /**
     * 按失败时间倒序列出
     *
     * @param targetName 为空时不按目标过滤
     */
    List<DeadLetterEntry> list(String targetName, int limit);

    Optional<DeadLetterEntry> get(String id);

    /**
     * 原地更新已有记录，记录不存在时忽略
     */
    void update(DeadLetterEntry entry);

    boolean remove(String id);

    int purgeOlderThan(Instant cutoff);

    int clear();

    int size();

    DeadLetterStats getStats();
}
