package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 通知渠道类型
 */
public enum ChannelType {

    DASHBOARD("dashboard", "控制台"),
    EMAIL("email", "邮件"),
    SLACK("slack", "Slack"),
    TELEGRAM("telegram", "Telegram"),
    WEBHOOK("webhook", "Webhook");

    private final String code;
    private final String description;

    ChannelType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    @JsonCreator
    public static ChannelType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ChannelType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的通知渠道: " + code);
    }
}
