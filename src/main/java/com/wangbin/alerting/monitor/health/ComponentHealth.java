package com.wangbin.alerting.monitor.health;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 告警引擎单个组件（调度器、采集器、渠道、仓储）的健康状态
 */
@Value
@Builder
public class ComponentHealth {

    String name;
    EngineHealth.Status status;
    String message;

    @Builder.Default
    Map<String, Object> details = new LinkedHashMap<>();
}
