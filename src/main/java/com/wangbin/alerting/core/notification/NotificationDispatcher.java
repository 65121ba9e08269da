package com.wangbin.alerting.core.notification;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.core.config.AlertingProperties;
import com.wangbin.alerting.core.notification.transport.NotificationTransport;
import com.wangbin.alerting.core.registry.NotificationChannelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 通知分发器
 *
 * 按告警创建时确定的渠道集合逐一投递。渠道未启用或级别不在过滤范围内则跳过；
 * 单个渠道失败或超时只影响自身，每个渠道对同一告警最多投递一次。
 */
@Slf4j
@Component
public class NotificationDispatcher {

    private final NotificationChannelRegistry channelRegistry;
    private final Map<ChannelType, NotificationTransport> transports = new EnumMap<>(ChannelType.class);
    private final ExecutorService executor;
    private final AlertingProperties properties;

    public NotificationDispatcher(NotificationChannelRegistry channelRegistry,
                                  List<NotificationTransport> transports,
                                  @Qualifier("notificationExecutor") ExecutorService executor,
                                  AlertingProperties properties) {
        this.channelRegistry = channelRegistry;
        this.executor = executor;
        this.properties = properties;
        for (NotificationTransport transport : transports) {
            this.transports.put(transport.getChannelType(), transport);
        }
        log.info("通知分发器初始化完成，已注册传输: {}", this.transports.keySet());
    }

    /**
     * 投递告警到其渠道集合
     *
     * @return 实际尝试投递的渠道结果，跳过的渠道不在其中
     */
    public List<DeliveryResult> dispatch(Alert alert) {
        AlertSummary summary = AlertSummary.from(alert);
        Map<ChannelType, Future<DeliveryResult>> pending = new LinkedHashMap<>();

        for (ChannelType type : new LinkedHashSet<>(alert.getNotificationChannels())) {
            Optional<NotificationChannel> channel = channelRegistry.get(type);
            if (channel.isEmpty() || !channel.get().accepts(alert.getSeverity())) {
                log.debug("跳过渠道 {}：未启用或不接受级别 {}", type, alert.getSeverity());
                continue;
            }
            NotificationTransport transport = transports.get(type);
            if (transport == null) {
                log.warn("渠道 {} 没有可用的传输实现", type);
                continue;
            }
            NotificationChannel target = channel.get();
            try {
                pending.put(type, executor.submit(() -> transport.send(summary, target)));
            } catch (RejectedExecutionException e) {
                log.warn("通知线程池已满，渠道 {} 投递被拒绝: {}", type, alert.getId());
                pending.put(type, null);
            }
        }

        List<DeliveryResult> results = new ArrayList<>(pending.size());
        long deadline = System.currentTimeMillis() + properties.getNotificationSettings().getSendTimeout().toMillis();
        for (Map.Entry<ChannelType, Future<DeliveryResult>> entry : pending.entrySet()) {
            results.add(await(entry.getKey(), entry.getValue(), deadline, alert.getId()));
        }

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        if (failed > 0) {
            log.warn("告警 {} 通知完成，{}/{} 个渠道失败", alert.getId(), failed, results.size());
        }
        return results;
    }

    private DeliveryResult await(ChannelType type, Future<DeliveryResult> future, long deadline, String alertId) {
        if (future == null) {
            return DeliveryResult.failure(type, "rejected", 0);
        }
        long remaining = Math.max(0, deadline - System.currentTimeMillis());
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("渠道 {} 投递超时: {}", type, alertId);
            return DeliveryResult.failure(type, "timeout", remaining);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DeliveryResult.failure(type, "interrupted", 0);
        } catch (ExecutionException e) {
            log.warn("渠道 {} 投递异常: {}", type, alertId, e.getCause());
            return DeliveryResult.failure(type, String.valueOf(e.getCause()), 0);
        }
    }

    public Map<String, Map<String, Object>> getTransportStatistics() {
        Map<String, Map<String, Object>> stats = new LinkedHashMap<>();
        transports.forEach((type, transport) -> stats.put(type.getCode(), transport.getStatistics()));
        return stats;
    }
}
