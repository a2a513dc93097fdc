package com.wangbin.alerting.core.storage;

import com.wangbin.alerting.common.domain.entity.Alert;

import java.util.List;

/**
 * 告警存储
 */
public interface AlertStorage {

    void store(Alert alert);

    /**
     * 最近收到的告警，新的在前
     */
    List<Alert> recent(int limit);

    int size();
}
