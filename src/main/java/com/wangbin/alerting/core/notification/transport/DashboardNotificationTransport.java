package com.wangbin.alerting.core.notification.transport;

import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.core.notification.AlertSummary;
import com.wangbin.alerting.core.notification.DashboardNotification;
import com.wangbin.alerting.core.notification.DashboardNotificationStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;

/**
 * 控制台通知：写入本地通知存储
 */
@Component
public class DashboardNotificationTransport extends AbstractNotificationTransport {

    private final DashboardNotificationStore store;
    private final Clock clock;

    public DashboardNotificationTransport(DashboardNotificationStore store, Clock clock) {
        super(ChannelType.DASHBOARD);
        this.store = store;
        this.clock = clock;
    }

    @Override
    protected void doSend(AlertSummary summary, NotificationChannel channel) {
        store.insert(DashboardNotification.builder()
                .alertId(summary.getAlertId())
                .type(summary.getType().getCode())
                .severity(summary.getSeverity().getCode())
                .title(summary.getTitle())
                .message(summary.getMessage())
                .timestamp(summary.getTimestamp())
                .acknowledged(summary.isAcknowledged())
                .escalated(summary.isEscalated())
                .metadata(new LinkedHashMap<>(summary.getMetadata()))
                .createdAt(clock.instant())
                .build());
    }
}
