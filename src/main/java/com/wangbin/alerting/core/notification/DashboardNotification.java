package com.wangbin.alerting.core.notification;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 控制台通知记录
 */
@Value
@Builder
public class DashboardNotification {
    String alertId;
    String type;
    String severity;
    String title;
    String message;
    Instant timestamp;
    boolean acknowledged;
    boolean escalated;
    Map<String, Object> metadata;
    Instant createdAt;
}
