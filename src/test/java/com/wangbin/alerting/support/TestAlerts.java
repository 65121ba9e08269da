package com.wangbin.alerting.support;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.utils.IdGenerator;
import com.wangbin.alerting.core.registry.ChannelRouting;

import java.time.Instant;
import java.util.ArrayList;

public final class TestAlerts {

    private TestAlerts() {
    }

    public static Alert alert(AlertType type, String metric, AlertSeverity severity, Instant timestamp) {
        return Alert.builder()
                .id(IdGenerator.generateAlertId("test", metric, timestamp.toEpochMilli()))
                .type(type)
                .severity(severity)
                .title(metric + " alert")
                .message(metric + " out of range")
                .source("test")
                .metric(metric)
                .currentValue(1.0)
                .confidence(0.9)
                .timestamp(timestamp)
                .autoResolve(true)
                .notificationChannels(new ArrayList<>(ChannelRouting.channelsFor(severity)))
                .build();
    }
}
