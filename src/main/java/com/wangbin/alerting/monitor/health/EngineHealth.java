package com.wangbin.alerting.monitor.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 告警引擎整体健康状态
 */
@Value
@Builder
public class EngineHealth {

    Status status;

    Instant checkedAt;

    @Builder.Default
    Map<String, ComponentHealth> components = new LinkedHashMap<>();

    public enum Status {
        UP,
        DEGRADED,
        STOPPED,
        DOWN
    }

    /**
     * 整体状态取最差的组件状态，优先级 DOWN > STOPPED > DEGRADED > UP
     */
    public static Status aggregate(Collection<ComponentHealth> componentHealths) {
        Status worst = Status.UP;
        for (ComponentHealth component : componentHealths) {
            if (component != null && component.getStatus().ordinal() > worst.ordinal()) {
                worst = component.getStatus();
            }
        }
        return worst;
    }
}
