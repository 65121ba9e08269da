package com.wangbin.alerting.core.notification.transport;

import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.common.utils.JsonUtil;
import com.wangbin.alerting.core.notification.AlertSummary;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Slack Incoming Webhook 通知
 */
@Component
public class SlackNotificationTransport extends AbstractNotificationTransport {

    private final RestTemplate restTemplate;

    public SlackNotificationTransport(@Qualifier("notificationRestTemplate") RestTemplate restTemplate) {
        super(ChannelType.SLACK);
        this.restTemplate = restTemplate;
    }

    @Override
    protected void doSend(AlertSummary summary, NotificationChannel channel) {
        String body = JsonUtil.toJsonString(Map.of("text", summary.toText()));
        HttpPosts.postJson(restTemplate, channel.getEndpoint(), body, channelType);
    }
}
