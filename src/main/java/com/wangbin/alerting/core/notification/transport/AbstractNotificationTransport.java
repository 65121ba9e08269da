package com.wangbin.alerting.core.notification.transport;

import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.core.notification.AlertSummary;
import com.wangbin.alerting.core.notification.DeliveryResult;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 抽象通知传输
 *
 * 职责：
 * 1. 统一捕获发送异常并转换为失败结果
 * 2. 记录发送统计
 */
@Slf4j
public abstract class AbstractNotificationTransport implements NotificationTransport {

    protected final ChannelType channelType;

    protected final AtomicLong totalSendCount = new AtomicLong(0);
    protected final AtomicLong successSendCount = new AtomicLong(0);
    protected final AtomicLong failureSendCount = new AtomicLong(0);
    protected final AtomicLong totalCostTime = new AtomicLong(0);

    protected AbstractNotificationTransport(ChannelType channelType) {
        this.channelType = channelType;
    }

    @Override
    public ChannelType getChannelType() {
        return channelType;
    }

    @Override
    public final DeliveryResult send(AlertSummary summary, NotificationChannel channel) {
        long startTime = System.currentTimeMillis();
        totalSendCount.incrementAndGet();
        try {
            doSend(summary, channel);
            long costTime = System.currentTimeMillis() - startTime;
            recordSend(true, costTime);
            log.debug("告警通知发送成功：{} -> {}，耗时 {}ms", summary.getAlertId(), channelType, costTime);
            return DeliveryResult.success(channelType, costTime);
        } catch (Exception e) {
            long costTime = System.currentTimeMillis() - startTime;
            recordSend(false, costTime);
            log.warn("告警通知发送失败：{} -> {}，错误：{}", summary.getAlertId(), channelType, e.getMessage(), e);
            return DeliveryResult.failure(channelType, e.getMessage(), costTime);
        }
    }

    /**
     * 执行具体发送，失败直接抛出异常
     */
    protected abstract void doSend(AlertSummary summary, NotificationChannel channel) throws Exception;

    private void recordSend(boolean success, long costTime) {
        if (success) {
            successSendCount.incrementAndGet();
        } else {
            failureSendCount.incrementAndGet();
        }
        totalCostTime.addAndGet(costTime);
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        long total = totalSendCount.get();
        stats.put("channel", channelType.getCode());
        stats.put("totalSendCount", total);
        stats.put("successSendCount", successSendCount.get());
        stats.put("failureSendCount", failureSendCount.get());
        stats.put("successRate", total > 0 ? (double) successSendCount.get() / total * 100 : 0.0);
        stats.put("avgCostTime", total > 0 ? (double) totalCostTime.get() / total : 0.0);
        return stats;
    }
}
