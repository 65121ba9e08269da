package com.wangbin.alerting.core.notification;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 发送给通知渠道的告警摘要
 */
@Value
@Builder
public class AlertSummary {

    String alertId;
    AlertType type;
    AlertSeverity severity;
    String title;
    String message;
    String source;
    String metric;
    Double currentValue;
    Double threshold;
    double confidence;
    Instant timestamp;
    boolean acknowledged;
    boolean escalated;
    List<String> suggestedActions;
    Map<String, Object> metadata;

    public static AlertSummary from(Alert alert) {
        return AlertSummary.builder()
                .alertId(alert.getId())
                .type(alert.getType())
                .severity(alert.getSeverity())
                .title(alert.getTitle())
                .message(alert.getMessage())
                .source(alert.getSource())
                .metric(alert.getMetric())
                .currentValue(alert.getCurrentValue())
                .threshold(alert.getThreshold())
                .confidence(alert.getConfidence())
                .timestamp(alert.getTimestamp())
                .acknowledged(alert.isAcknowledged())
                .escalated(Boolean.TRUE.equals(alert.getMetadataValue("escalated")))
                .suggestedActions(List.copyOf(alert.getSuggestedActions()))
                .metadata(new LinkedHashMap<>(alert.getMetadata()))
                .build();
    }

    /**
     * 单行标题，例如 "[CRITICAL] High error rate detected"
     */
    public String headline() {
        String prefix = escalated ? "[ESCALATED][" : "[";
        return prefix + severity.getCode().toUpperCase(Locale.ROOT) + "] " + title;
    }

    /**
     * 结构化载荷，枚举输出小写编码，时间输出 ISO-8601
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alert_id", alertId);
        payload.put("type", type != null ? type.getCode() : null);
        payload.put("severity", severity != null ? severity.getCode() : null);
        payload.put("title", title);
        payload.put("message", message);
        payload.put("source", source);
        payload.put("metric", metric);
        payload.put("current_value", currentValue);
        payload.put("threshold", threshold);
        payload.put("confidence", confidence);
        payload.put("timestamp", timestamp != null ? timestamp.toString() : null);
        payload.put("acknowledged", acknowledged);
        payload.put("escalated", escalated);
        payload.put("suggested_actions", suggestedActions);
        payload.put("metadata", metadata);
        return payload;
    }

    /**
     * 纯文本正文，供邮件与即时消息渠道使用
     */
    public String toText() {
        StringBuilder text = new StringBuilder(headline()).append('\n').append(message);
        if (metric != null) {
            text.append("\nMetric: ").append(metric);
        }
        if (currentValue != null) {
            text.append("\nCurrent value: ").append(currentValue);
        }
        if (threshold != null) {
            text.append("\nThreshold: ").append(threshold);
        }
        if (suggestedActions != null && !suggestedActions.isEmpty()) {
            text.append("\nSuggested actions:");
            for (String action : suggestedActions) {
                text.append("\n- ").append(action);
            }
        }
        text.append("\nAlert ID: ").append(alertId);
        return text.toString();
    }
}
