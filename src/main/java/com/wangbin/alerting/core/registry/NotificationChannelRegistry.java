package com.wangbin.alerting.core.registry;

import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.core.config.AlertingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 通知渠道注册表
 *
 * 启动时根据配置是否齐全决定各渠道是否启用，之后只能通过 {@link #reconfigure} 整体替换。
 * 控制台渠道始终存在并接受所有级别。
 */
@Slf4j
@Component
public class NotificationChannelRegistry {

    private final Map<ChannelType, NotificationChannel> channels =
            Collections.synchronizedMap(new EnumMap<>(ChannelType.class));

    public NotificationChannelRegistry(AlertingProperties properties) {
        AlertingProperties.Channels config = properties.getChannels();

        register(NotificationChannel.builder()
                .type(ChannelType.DASHBOARD)
                .enabled(true)
                .severityFilter(EnumSet.allOf(AlertSeverity.class))
                .build());

        AlertingProperties.EmailChannel email = config.getEmail();
        List<String> recipients = email.getRecipients() == null ? List.of() : email.getRecipients().stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        register(NotificationChannel.builder()
                .type(ChannelType.EMAIL)
                .enabled(email.isEnabled() && !recipients.isEmpty())
                .severityFilter(EnumSet.of(AlertSeverity.MEDIUM, AlertSeverity.HIGH, AlertSeverity.CRITICAL))
                .recipients(recipients)
                .build());

        String slackUrl = config.getSlack().getWebhookUrl();
        register(NotificationChannel.builder()
                .type(ChannelType.SLACK)
                .enabled(hasText(slackUrl))
                .severityFilter(EnumSet.of(AlertSeverity.HIGH, AlertSeverity.CRITICAL))
                .endpoint(slackUrl)
                .build());

        AlertingProperties.TelegramChannel telegram = config.getTelegram();
        register(NotificationChannel.builder()
                .type(ChannelType.TELEGRAM)
                .enabled(hasText(telegram.getBotToken()) && hasText(telegram.getChatId()))
                .severityFilter(EnumSet.of(AlertSeverity.CRITICAL))
                .endpoint(telegram.getApiBaseUrl())
                .apiKey(telegram.getBotToken())
                .recipients(hasText(telegram.getChatId()) ? List.of(telegram.getChatId()) : List.of())
                .build());

        String webhookUrl = config.getWebhook().getUrl();
        register(NotificationChannel.builder()
                .type(ChannelType.WEBHOOK)
                .enabled(hasText(webhookUrl))
                .severityFilter(EnumSet.of(AlertSeverity.HIGH, AlertSeverity.CRITICAL))
                .endpoint(webhookUrl)
                .build());

        log.info("通知渠道初始化完成，已启用: {}", enabledTypes());
    }

    public Optional<NotificationChannel> get(ChannelType type) {
        return Optional.ofNullable(channels.get(type));
    }

    public List<NotificationChannel> getAll() {
        synchronized (channels) {
            return new ArrayList<>(channels.values());
        }
    }

    public List<ChannelType> enabledTypes() {
        synchronized (channels) {
            return channels.values().stream()
                    .filter(NotificationChannel::isEnabled)
                    .map(NotificationChannel::getType)
                    .toList();
        }
    }

    /**
     * 显式重新配置渠道的启用状态和级别过滤，null 参数表示保持原值
     *
     * @return 渠道不存在时返回 false
     */
    public boolean reconfigure(ChannelType type, Boolean enabled, Set<AlertSeverity> severityFilter) {
        if (type == null) {
            return false;
        }
        if (type == ChannelType.DASHBOARD && Boolean.FALSE.equals(enabled)) {
            log.warn("控制台渠道不可禁用");
            return false;
        }
        NotificationChannel updated = channels.computeIfPresent(type, (key, existing) -> existing.toBuilder()
                .enabled(enabled != null ? enabled : existing.isEnabled())
                .severityFilter(severityFilter != null
                        ? Collections.unmodifiableSet(EnumSet.copyOf(nonEmpty(severityFilter)))
                        : existing.getSeverityFilter())
                .build());
        if (updated != null) {
            log.info("通知渠道已重新配置: {} enabled={} filter={}",
                    type, updated.isEnabled(), updated.getSeverityFilter());
        }
        return updated != null;
    }

    private void register(NotificationChannel channel) {
        channels.put(channel.getType(), channel);
    }

    private static Set<AlertSeverity> nonEmpty(Set<AlertSeverity> filter) {
        return filter.isEmpty() ? EnumSet.noneOf(AlertSeverity.class) : filter;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
