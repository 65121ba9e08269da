package com.wangbin.alerting.core.collector;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertType;

import java.util.List;

/**
 * 告警采集器接口
 *
 * 每个实现负责一个告警类别，从各自的数据源读取并生成候选告警。
 * 实现必须自行隔离失败：数据源异常时返回空列表，不得抛出。
 */
public interface AlertCollector {

    /**
     * 采集器名称，同时作为告警的 source 字段
     */
    String getName();

    AlertType getAlertType();

    /**
     * 生成本轮的候选告警
     *
     * @return 候选告警列表，无告警或失败时返回空列表
     */
    List<Alert> collect();

    /**
     * 最近一次执行状态
     */
    CollectorStatus getStatus();
}
