package com.wangbin.alerting.common.domain.entity;

import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 告警实体
 *
 * notificationChannels 在创建时根据级别计算，之后渠道配置变化不会回写到已有告警。
 * acknowledged / resolved 仅允许由生命周期管理器在引擎锁内修改。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String id;

    private AlertType type;

    private AlertSeverity severity;

    private String title;

    private String message;

    /**
     * 产生告警的采集器标识
     */
    private String source;

    private String metric;

    private Double currentValue;

    private Double expectedValue;

    private Double threshold;

    /**
     * 置信度 [0,1]
     */
    private double confidence;

    private Instant timestamp;

    private boolean acknowledged;

    private boolean resolved;

    private boolean autoResolve;

    @Builder.Default
    private List<String> suggestedActions = new ArrayList<>();

    @Builder.Default
    private List<String> relatedAlerts = new ArrayList<>();

    @Builder.Default
    private List<ChannelType> notificationChannels = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public void addMetadata(String key, Object value) {
        if (this.metadata == null) {
            this.metadata = new LinkedHashMap<>();
        }
        this.metadata.put(key, value);
    }

    public Object getMetadataValue(String key) {
        return metadata != null ? metadata.get(key) : null;
    }

    /**
     * 去重键：类型 + 指标 + 级别
     */
    public String dedupKey() {
        return type + "|" + metric + "|" + severity;
    }

    /**
     * 限流键：类型 + 指标，不同级别共享同一配额
     */
    public String rateLimitKey() {
        return (type != null ? type.getCode() : "unknown") + "_" + metric;
    }

    /**
     * 返回一份可独立修改的拷贝，用于对外暴露
     */
    public Alert copy() {
        return this.copyBuilder().build();
    }

    private AlertBuilder copyBuilder() {
        return Alert.builder()
                .id(id)
                .type(type)
                .severity(severity)
                .title(title)
                .message(message)
                .source(source)
                .metric(metric)
                .currentValue(currentValue)
                .expectedValue(expectedValue)
                .threshold(threshold)
                .confidence(confidence)
                .timestamp(timestamp)
                .acknowledged(acknowledged)
                .resolved(resolved)
                .autoResolve(autoResolve)
                .suggestedActions(suggestedActions != null ? new ArrayList<>(suggestedActions) : new ArrayList<>())
                .relatedAlerts(relatedAlerts != null ? new ArrayList<>(relatedAlerts) : new ArrayList<>())
                .notificationChannels(notificationChannels != null ? new ArrayList<>(notificationChannels) : new ArrayList<>())
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>());
    }
}
