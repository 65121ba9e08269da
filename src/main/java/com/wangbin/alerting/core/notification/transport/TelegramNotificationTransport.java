package com.wangbin.alerting.core.notification.transport;

import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.common.exception.AlertingException;
import com.wangbin.alerting.common.utils.JsonUtil;
import com.wangbin.alerting.core.notification.AlertSummary;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telegram Bot API 通知
 */
@Component
public class TelegramNotificationTransport extends AbstractNotificationTransport {

    private final RestTemplate restTemplate;

    public TelegramNotificationTransport(@Qualifier("notificationRestTemplate") RestTemplate restTemplate) {
        super(ChannelType.TELEGRAM);
        this.restTemplate = restTemplate;
    }

    @Override
    protected void doSend(AlertSummary summary, NotificationChannel channel) {
        if (channel.getApiKey() == null || channel.getRecipients().isEmpty()) {
            throw AlertingException.notificationFailure(channelType.getCode(), "缺少 bot token 或 chat id");
        }
        String url = sendMessageUrl(channel.getEndpoint(), channel.getApiKey());
        for (String chatId : channel.getRecipients()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("chat_id", chatId);
            body.put("text", summary.toText());
            body.put("disable_web_page_preview", true);
            HttpPosts.postJson(restTemplate, url, JsonUtil.toJsonString(body), channelType);
        }
    }

    static String sendMessageUrl(String apiBaseUrl, String botToken) {
        String base = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        return base + "/bot" + botToken + "/sendMessage";
    }
}
