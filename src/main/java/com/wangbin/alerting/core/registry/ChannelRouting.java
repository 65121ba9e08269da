package com.wangbin.alerting.core.registry;

import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.ChannelType;

import java.util.List;

/**
 * 告警级别到默认通知渠道的映射
 */
public final class ChannelRouting {

    private ChannelRouting() {
    }

    public static List<ChannelType> channelsFor(AlertSeverity severity) {
        if (severity == null) {
            return List.of(ChannelType.DASHBOARD);
        }
        return switch (severity) {
            case CRITICAL -> List.of(ChannelType.DASHBOARD, ChannelType.EMAIL, ChannelType.SLACK, ChannelType.TELEGRAM);
            case HIGH -> List.of(ChannelType.DASHBOARD, ChannelType.EMAIL, ChannelType.SLACK);
            case MEDIUM -> List.of(ChannelType.DASHBOARD, ChannelType.EMAIL);
            case LOW -> List.of(ChannelType.DASHBOARD);
        };
    }
}
