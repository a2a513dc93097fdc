package com.wangbin.alerting.core.publish.formatter;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.entity.Target;

import java.util.Map;

/**
 * 目标格式化器，纯函数：同样的输入产生同样的载荷
 */
public interface AlertFormatter {

    /**
     * 支持的目标类型
     */
    String getType();

    Map<String, Object> format(Alert alert, Classification classification, Target target);
}
