package com.wangbin.alerting.core.target;

import com.wangbin.alerting.common.domain.entity.Target;

import java.util.List;

/**
 * 目标发现，注入到目标注册表中，核心流程不关心其底层来源
 */
public interface TargetDiscovery {

    /**
     * 列出当前全部目标
     *
     * @throws TargetDiscoveryException 发现失败，注册表保留上一次的快照
     */
    List<Target> listTargets() throws TargetDiscoveryException;
}
