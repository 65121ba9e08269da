package com.wangbin.alerting.core.notification.transport;

import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.core.notification.AlertSummary;
import com.wangbin.alerting.core.notification.DeliveryResult;

import java.util.Map;

/**
 * 通知传输接口，每种渠道一个实现
 */
public interface NotificationTransport {

    ChannelType getChannelType();

    /**
     * 发送告警摘要
     *
     * @param summary 告警摘要
     * @param channel 当前渠道配置（地址、收件人、密钥）
     * @return 投递结果，失败不抛异常
     */
    DeliveryResult send(AlertSummary summary, NotificationChannel channel);

    Map<String, Object> getStatistics();
}
