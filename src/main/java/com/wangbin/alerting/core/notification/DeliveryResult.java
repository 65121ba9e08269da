package com.wangbin.alerting.core.notification;

import com.wangbin.alerting.common.domain.enums.ChannelType;
import lombok.Value;

/**
 * 单个渠道的投递结果
 */
@Value
public class DeliveryResult {

    ChannelType channel;
    boolean success;
    String errorMessage;
    long costTime;

    public static DeliveryResult success(ChannelType channel, long costTime) {
        return new DeliveryResult(channel, true, null, costTime);
    }

    public static DeliveryResult failure(ChannelType channel, String errorMessage, long costTime) {
        return new DeliveryResult(channel, false, errorMessage, costTime);
    }
}
