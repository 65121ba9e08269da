package com.wangbin.alerting.core.service;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.AlertThreshold;
import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.entity.ThresholdPatch;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.core.lifecycle.AlertLifecycleManager;
import com.wangbin.alerting.core.notification.DashboardNotification;
import com.wangbin.alerting.core.notification.DashboardNotificationStore;
import com.wangbin.alerting.core.pipeline.ActiveAlertStore;
import com.wangbin.alerting.core.pipeline.TickReport;
import com.wangbin.alerting.core.registry.NotificationChannelRegistry;
import com.wangbin.alerting.core.registry.ThresholdRegistry;
import com.wangbin.alerting.core.scheduler.AlertScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 告警引擎对外操作入口
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntelligentAlertService {

    private final AlertScheduler scheduler;
    private final ActiveAlertStore store;
    private final AlertLifecycleManager lifecycleManager;
    private final ThresholdRegistry thresholdRegistry;
    private final NotificationChannelRegistry channelRegistry;
    private final DashboardNotificationStore dashboardStore;

    public boolean start() {
        return scheduler.start();
    }

    public boolean stop() {
        return scheduler.stop();
    }

    public boolean isRunning() {
        return scheduler.isRunning();
    }

    /**
     * 手动触发一轮流水线
     */
    public Optional<TickReport> runNow() {
        return scheduler.runOnce();
    }

    /**
     * 活动告警快照，按创建时间倒序
     */
    public List<Alert> getActiveAlerts() {
        return store.snapshot().stream()
                .sorted(Comparator.comparing(Alert::getTimestamp,
                        Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed())
                .toList();
    }

    public Optional<Alert> getActiveAlert(String id) {
        return store.withLock(() -> store.get(id).map(Alert::copy));
    }

    public boolean acknowledge(String id) {
        return lifecycleManager.acknowledge(id);
    }

    public boolean resolve(String id) {
        return lifecycleManager.resolve(id);
    }

    public boolean updateThreshold(String metric, ThresholdPatch patch) {
        boolean updated = lifecycleManager.updateThreshold(metric, patch);
        if (!updated) {
            log.info("阈值未更新，指标不存在或合并后不合法: {}", metric);
        }
        return updated;
    }

    public List<AlertThreshold> getThresholds() {
        return thresholdRegistry.getAll();
    }

    public AlertStatistics getStatistics() {
        List<Alert> alerts = store.snapshot();
        Map<String, Long> bySeverity = alerts.stream()
                .collect(Collectors.groupingBy(a -> a.getSeverity().getCode(), TreeMap::new, Collectors.counting()));
        Map<String, Long> byType = alerts.stream()
                .collect(Collectors.groupingBy(a -> a.getType().getCode(), TreeMap::new, Collectors.counting()));
        return AlertStatistics.builder()
                .total(alerts.size())
                .bySeverity(bySeverity)
                .byType(byType)
                .acknowledged(alerts.stream().filter(Alert::isAcknowledged).count())
                .resolved(store.resolvedInHistory())
                .build();
    }

    public List<NotificationChannel> getChannels() {
        return channelRegistry.getAll();
    }

    public boolean reconfigureChannel(ChannelType type, Boolean enabled, Set<AlertSeverity> severityFilter) {
        return channelRegistry.reconfigure(type, enabled, severityFilter);
    }

    public List<DashboardNotification> getDashboardNotifications(int limit) {
        return dashboardStore.recent(limit);
    }

    public Map<String, Object> getEngineStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", scheduler.isRunning());
        status.put("startedAt", scheduler.getStartedAt());
        status.put("activeAlerts", store.size());
        status.put("tickCount", scheduler.getTickCount());
        status.put("lastTick", scheduler.getLastTickReport());
        return status;
    }
}
