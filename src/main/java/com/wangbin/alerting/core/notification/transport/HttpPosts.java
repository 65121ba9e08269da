package com.wangbin.alerting.core.notification.transport;

import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.common.exception.AlertingException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

final class HttpPosts {

    private HttpPosts() {
    }

    static void postJson(RestTemplate restTemplate, String url, String body, ChannelType channel) {
        if (url == null || url.isBlank()) {
            throw AlertingException.notificationFailure(channel.getCode(), "未配置投递地址");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw AlertingException.notificationFailure(channel.getCode(),
                    "投递返回状态码 " + response.getStatusCode().value());
        }
    }
}
