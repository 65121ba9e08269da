package com.wangbin.alerting.core.lifecycle;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.AlertThreshold;
import com.wangbin.alerting.common.domain.entity.ThresholdPatch;
import com.wangbin.alerting.core.notification.NotificationDispatcher;
import com.wangbin.alerting.core.persistence.AlertPersister;
import com.wangbin.alerting.core.pipeline.ActiveAlertStore;
import com.wangbin.alerting.core.registry.ThresholdRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 告警生命周期管理
 *
 * 状态：活动 → 已确认（不影响恢复）→ 已恢复（终态）。
 * 状态修改在引擎锁内完成，持久化与通知在锁外执行。
 */
@Slf4j
@Component
public class AlertLifecycleManager {

    public static final String RESOLVED_BY = "resolved_by";

    private final ActiveAlertStore store;
    private final AlertPersister persister;
    private final ThresholdRegistry thresholdRegistry;
    private final NotificationDispatcher dispatcher;
    private final EscalationHandler escalationHandler;
    private final Clock clock;

    public AlertLifecycleManager(ActiveAlertStore store, AlertPersister persister,
                                 ThresholdRegistry thresholdRegistry, NotificationDispatcher dispatcher,
                                 EscalationHandler escalationHandler, Clock clock) {
        this.store = store;
        this.persister = persister;
        this.thresholdRegistry = thresholdRegistry;
        this.dispatcher = dispatcher;
        this.escalationHandler = escalationHandler;
        this.clock = clock;
    }

    /**
     * 确认告警
     *
     * @return 告警不在活动集合中返回 false
     */
    public boolean acknowledge(String id) {
        Optional<Alert> acknowledged = store.withLock(() -> store.get(id).map(alert -> {
            alert.setAcknowledged(true);
            alert.addMetadata("acknowledged_at", clock.instant().toString());
            return alert.copy();
        }));
        if (acknowledged.isEmpty()) {
            return false;
        }
        persistIfActive(acknowledged.get());
        log.info("告警已确认: {}", id);
        return true;
    }

    /**
     * 恢复告警并移出活动集合
     *
     * @return 告警不在活动集合中返回 false
     */
    public boolean resolve(String id) {
        Optional<Alert> resolved = store.withLock(() -> store.remove(id).map(alert -> {
            markResolved(alert, "manual");
            return alert.copy();
        }));
        if (resolved.isEmpty()) {
            return false;
        }
        persister.persist(resolved.get());
        log.info("告警已恢复: {}", id);
        return true;
    }

    /**
     * 清理活动集合：移除已标记恢复的告警，并自动恢复超过阈值超时的告警
     *
     * @return 本次移出活动集合的告警数
     */
    public int cleanup() {
        Instant now = clock.instant();
        List<Alert> purged = new ArrayList<>();
        List<Alert> autoResolved = new ArrayList<>();

        store.withLock(() -> {
            for (Alert alert : store.activeAlerts()) {
                if (alert.isResolved()) {
                    store.remove(alert.getId());
                    purged.add(alert);
                } else if (autoResolveDue(alert, now)) {
                    store.remove(alert.getId());
                    markResolved(alert, "auto");
                    autoResolved.add(alert.copy());
                }
            }
        });

        autoResolved.forEach(persister::persist);
        if (!purged.isEmpty()) {
            log.info("清理已恢复告警 {} 条", purged.size());
        }
        if (!autoResolved.isEmpty()) {
            log.info("自动恢复超时告警 {} 条", autoResolved.size());
        }
        return purged.size() + autoResolved.size();
    }

    /**
     * 升级检查：由升级处理器挑选告警，标记后重新投递并持久化
     *
     * @return 本轮升级的告警数
     */
    public int handleEscalations() {
        Instant now = clock.instant();
        List<Alert> escalated = store.withLock(() -> {
            List<Alert> selected = escalationHandler.select(store.activeAlerts(), now);
            List<Alert> copies = new ArrayList<>(selected.size());
            for (Alert alert : selected) {
                alert.addMetadata(UnacknowledgedEscalationHandler.ESCALATED, true);
                alert.addMetadata("escalated_at", now.toString());
                copies.add(alert.copy());
            }
            return copies;
        });

        for (Alert alert : escalated) {
            log.warn("告警超时未确认，升级通知: {} [{}]", alert.getId(), alert.getSeverity());
            dispatcher.dispatch(alert);
            persistIfActive(alert);
        }
        return escalated.size();
    }

    /**
     * 合并更新已存在指标的阈值，未知指标不做任何修改
     */
    public boolean updateThreshold(String metric, ThresholdPatch patch) {
        return thresholdRegistry.update(metric, patch);
    }

    /**
     * 写入未恢复告警的快照；快照生成后告警已被恢复则跳过，已恢复记录不会被旧快照覆盖
     */
    private void persistIfActive(Alert snapshot) {
        boolean active = store.get(snapshot.getId()).isPresent();
        if (!active) {
            log.debug("告警已移出活动集合，跳过快照写入: {}", snapshot.getId());
            return;
        }
        persister.persist(snapshot);
    }

    private boolean autoResolveDue(Alert alert, Instant now) {
        if (!alert.isAutoResolve() || alert.getTimestamp() == null || alert.getMetric() == null) {
            return false;
        }
        Optional<Integer> timeoutMinutes = thresholdRegistry.get(alert.getMetric())
                .map(AlertThreshold::getAutoResolveTimeout);
        return timeoutMinutes
                .filter(minutes -> minutes > 0)
                .map(minutes -> !alert.getTimestamp().plus(Duration.ofMinutes(minutes)).isAfter(now))
                .orElse(false);
    }

    private void markResolved(Alert alert, String resolvedBy) {
        alert.setResolved(true);
        alert.addMetadata(RESOLVED_BY, resolvedBy);
        alert.addMetadata("resolved_at", clock.instant().toString());
    }
}
