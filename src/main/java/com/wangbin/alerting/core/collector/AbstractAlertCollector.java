package com.wangbin.alerting.core.collector;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.utils.IdGenerator;
import com.wangbin.alerting.core.registry.ChannelRouting;
import com.wangbin.alerting.core.source.MetricSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 抽象告警采集器
 *
 * 职责：
 * 1. 隔离子类采集异常，失败时记录日志并返回空列表
 * 2. 记录执行统计
 * 3. 提供候选告警的通用构建方法（ID、时间戳、通知渠道）
 */
@Slf4j
public abstract class AbstractAlertCollector implements AlertCollector {

    protected final String name;
    protected final String idPrefix;
    protected final AlertType alertType;
    protected final MetricSource metricSource;
    protected final Clock clock;

    private final AtomicLong totalRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();
    private final AtomicLong totalCandidates = new AtomicLong();
    private volatile Long lastRunAt;
    private volatile Long lastDurationMs;
    private volatile boolean lastSucceeded = true;
    private volatile String lastError;

    protected AbstractAlertCollector(String name, String idPrefix, AlertType alertType,
                                     MetricSource metricSource, Clock clock) {
        this.name = name;
        this.idPrefix = idPrefix;
        this.alertType = alertType;
        this.metricSource = metricSource;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public AlertType getAlertType() {
        return alertType;
    }

    @Override
    public final List<Alert> collect() {
        long start = System.currentTimeMillis();
        totalRuns.incrementAndGet();
        lastRunAt = clock.millis();
        try {
            List<Alert> alerts = doCollect();
            List<Alert> result = alerts != null ? alerts : Collections.emptyList();
            totalCandidates.addAndGet(result.size());
            lastSucceeded = true;
            lastError = null;
            if (!result.isEmpty()) {
                log.debug("采集器 {} 生成 {} 条候选告警", name, result.size());
            }
            return result;
        } catch (Exception e) {
            failedRuns.incrementAndGet();
            lastSucceeded = false;
            lastError = e.getMessage();
            log.warn("采集器 {} 执行失败，本轮跳过: {}", name, e.getMessage(), e);
            return Collections.emptyList();
        } finally {
            lastDurationMs = System.currentTimeMillis() - start;
        }
    }

    /**
     * 子类实现具体采集逻辑，可直接抛出异常
     */
    protected abstract List<Alert> doCollect() throws Exception;

    @Override
    public CollectorStatus getStatus() {
        return CollectorStatus.builder()
                .name(name)
                .totalRuns(totalRuns.get())
                .failedRuns(failedRuns.get())
                .totalCandidates(totalCandidates.get())
                .lastRunAt(lastRunAt)
                .lastDurationMs(lastDurationMs)
                .lastSucceeded(lastSucceeded)
                .lastError(lastError)
                .build();
    }

    /**
     * 构建候选告警的通用字段，通知渠道在此按级别固定
     */
    protected Alert.AlertBuilder newAlert(String metric, AlertSeverity severity) {
        Instant now = clock.instant();
        return Alert.builder()
                .id(IdGenerator.generateAlertId(idPrefix, metric, now.toEpochMilli()))
                .type(alertType)
                .severity(severity)
                .source(name)
                .metric(metric)
                .timestamp(now)
                .acknowledged(false)
                .resolved(false)
                .autoResolve(true)
                .suggestedActions(new ArrayList<>())
                .relatedAlerts(new ArrayList<>())
                .notificationChannels(new ArrayList<>(ChannelRouting.channelsFor(severity)))
                .metadata(new LinkedHashMap<>());
    }
}
