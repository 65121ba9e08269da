package com.wangbin.alerting.core.persistence;

import com.wangbin.alerting.common.domain.entity.Alert;

import java.util.List;

/**
 * 告警持久化接口
 *
 * 实现失败时抛出 {@link com.wangbin.alerting.common.exception.AlertingException}，
 * 调用方负责记录日志并继续处理。
 */
public interface AlertRepository {

    /**
     * 按告警 ID 插入或覆盖
     *
     * 已恢复是终态：记录一旦以已恢复写入，之后到达的未恢复快照不得使其重新出现在 {@link #loadUnresolved()} 中。
     */
    void upsert(Alert alert);

    /**
     * 加载所有未恢复的告警，启动时用于预热活动告警集合
     */
    List<Alert> loadUnresolved();

    String getName();
}
