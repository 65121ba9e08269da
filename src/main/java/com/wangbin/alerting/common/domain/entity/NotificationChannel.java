package com.wangbin.alerting.common.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 通知渠道配置，不可变；重新配置时整体替换
 */
@Value
@Builder(toBuilder = true)
public class NotificationChannel {

    ChannelType type;

    boolean enabled;

    @Builder.Default
    Set<AlertSeverity> severityFilter = Collections.unmodifiableSet(EnumSet.allOf(AlertSeverity.class));

    /**
     * 投递地址（Slack/Webhook URL、Telegram API 地址），Slack 地址本身即凭据，不对外输出
     */
    @JsonIgnore
    String endpoint;

    @JsonIgnore
    String apiKey;

    @Builder.Default
    List<String> recipients = Collections.emptyList();

    public boolean accepts(AlertSeverity severity) {
        return enabled && severity != null && severityFilter.contains(severity);
    }
}
