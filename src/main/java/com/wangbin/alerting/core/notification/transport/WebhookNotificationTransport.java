package com.wangbin.alerting.core.notification.transport;

import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.common.utils.JsonUtil;
import com.wangbin.alerting.core.notification.AlertSummary;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * 通用 Webhook 通知，POST 完整的告警摘要 JSON
 */
@Component
public class WebhookNotificationTransport extends AbstractNotificationTransport {

    private final RestTemplate restTemplate;

    public WebhookNotificationTransport(@Qualifier("notificationRestTemplate") RestTemplate restTemplate) {
        super(ChannelType.WEBHOOK);
        this.restTemplate = restTemplate;
    }

    @Override
    protected void doSend(AlertSummary summary, NotificationChannel channel) {
        HttpPosts.postJson(restTemplate, channel.getEndpoint(),
                JsonUtil.toJsonString(summary.toPayload()), channelType);
    }
}
