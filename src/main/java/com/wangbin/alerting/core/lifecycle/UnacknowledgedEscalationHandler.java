package com.wangbin.alerting.core.lifecycle;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.core.config.AlertingProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 未确认升级：超过升级时限仍未确认、未恢复的告警升级一次
 */
public class UnacknowledgedEscalationHandler implements EscalationHandler {

    public static final String ESCALATED = "escalated";

    private final AlertingProperties properties;

    public UnacknowledgedEscalationHandler(AlertingProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<Alert> select(List<Alert> activeAlerts, Instant now) {
        Duration timeout = Duration.ofMinutes(properties.getNotificationSettings().getEscalationTimeoutMinutes());
        Instant cutoff = now.minus(timeout);
        return activeAlerts.stream()
                .filter(alert -> !alert.isAcknowledged() && !alert.isResolved())
                .filter(alert -> !Boolean.TRUE.equals(alert.getMetadataValue(ESCALATED)))
                .filter(alert -> alert.getTimestamp() != null && !alert.getTimestamp().isAfter(cutoff))
                .toList();
    }
}
