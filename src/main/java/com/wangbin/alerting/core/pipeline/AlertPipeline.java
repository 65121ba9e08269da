package com.wangbin.alerting.core.pipeline;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.core.collector.AlertCollector;
import com.wangbin.alerting.core.config.AlertingProperties;
import com.wangbin.alerting.core.lifecycle.AlertLifecycleManager;
import com.wangbin.alerting.core.notification.NotificationDispatcher;
import com.wangbin.alerting.core.persistence.AlertPersister;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 告警流水线
 *
 * 每轮执行步骤：
 * 1. 并发执行所有采集器，等待全部完成或超时
 * 2. 在引擎锁内逐条去重、限流并写入活动集合
 * 3. 锁外持久化并投递通知
 * 4. 模式学习（可选）
 * 5. 升级检查（可选）
 *
 * 单个采集器、单条告警的持久化或通知失败都不会中断本轮其余步骤。
 */
@Slf4j
@Component
public class AlertPipeline {

    private static final int LEARNING_HISTORY_SIZE = 100;

    private final List<AlertCollector> collectors;
    private final ActiveAlertStore store;
    private final AlertDeduplicator deduplicator;
    private final AlertRateLimiter rateLimiter;
    private final AlertPersister persister;
    private final NotificationDispatcher dispatcher;
    private final AlertLifecycleManager lifecycleManager;
    private final AlertPatternLearner patternLearner;
    private final ExecutorService collectorExecutor;
    private final AlertingProperties properties;
    private final Clock clock;

    public AlertPipeline(List<AlertCollector> collectors, ActiveAlertStore store,
                         AlertDeduplicator deduplicator, AlertRateLimiter rateLimiter,
                         AlertPersister persister, NotificationDispatcher dispatcher,
                         AlertLifecycleManager lifecycleManager, AlertPatternLearner patternLearner,
                         @Qualifier("collectorExecutor") ExecutorService collectorExecutor,
                         AlertingProperties properties, Clock clock) {
        this.collectors = List.copyOf(collectors);
        this.store = store;
        this.deduplicator = deduplicator;
        this.rateLimiter = rateLimiter;
        this.persister = persister;
        this.dispatcher = dispatcher;
        this.lifecycleManager = lifecycleManager;
        this.patternLearner = patternLearner;
        this.collectorExecutor = collectorExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 执行一轮告警流水线，调用方保证同一时刻只有一轮在执行
     */
    public TickReport runTick() {
        long startTime = System.currentTimeMillis();
        List<String> failedCollectors = new ArrayList<>();
        List<Alert> candidates = collectAll(failedCollectors);

        int[] duplicates = {0};
        int[] rateLimited = {0};
        List<Alert> accepted = new ArrayList<>();
        store.withLock(() -> {
            for (Alert candidate : candidates) {
                if (properties.isAutoAcknowledgeDuplicates()
                        && deduplicator.isDuplicate(candidate, store.activeAlerts())) {
                    duplicates[0]++;
                    log.debug("重复告警已抑制: {} {}", candidate.dedupKey(), candidate.getId());
                    continue;
                }
                if (properties.getNotificationSettings().isRateLimiting()
                        && !rateLimiter.tryAcquire(candidate.rateLimitKey())) {
                    rateLimited[0]++;
                    log.debug("告警触发限流已丢弃: {} {}", candidate.rateLimitKey(), candidate.getId());
                    continue;
                }
                store.add(candidate);
                accepted.add(candidate.copy());
            }
        });

        int persistFailures = 0;
        List<String> acceptedIds = new ArrayList<>(accepted.size());
        for (Alert alert : accepted) {
            acceptedIds.add(alert.getId());
            if (stillActive(alert) && !persister.persist(alert)) {
                persistFailures++;
            }
            try {
                dispatcher.dispatch(alert);
            } catch (RuntimeException e) {
                log.warn("告警通知分发异常: {}", alert.getId(), e);
            }
            log.info("告警已接受: {} ({}) [{}]", alert.getTitle(), alert.getSeverity().getCode(), alert.getId());
        }

        runPatternLearning();
        runEscalation();

        TickReport report = TickReport.builder()
                .candidates(candidates.size())
                .accepted(accepted.size())
                .duplicates(duplicates[0])
                .rateLimited(rateLimited[0])
                .persistFailures(persistFailures)
                .failedCollectors(failedCollectors)
                .acceptedIds(acceptedIds)
                .durationMs(System.currentTimeMillis() - startTime)
                .finishedAt(clock.instant())
                .build();
        log.debug("告警流水线执行完成: 候选={} 接受={} 重复={} 限流={} 耗时={}ms",
                report.getCandidates(), report.getAccepted(), report.getDuplicates(),
                report.getRateLimited(), report.getDurationMs());
        return report;
    }

    private List<Alert> collectAll(List<String> failedCollectors) {
        Map<AlertCollector, Future<List<Alert>>> futures = new LinkedHashMap<>();
        for (AlertCollector collector : collectors) {
            try {
                futures.put(collector, collectorExecutor.submit(collector::collect));
            } catch (RejectedExecutionException e) {
                log.warn("采集线程池已满，采集器 {} 本轮跳过", collector.getName());
                failedCollectors.add(collector.getName());
            }
        }

        List<Alert> candidates = new ArrayList<>();
        long deadline = System.currentTimeMillis() + properties.getCollectorTimeout().toMillis();
        for (Map.Entry<AlertCollector, Future<List<Alert>>> entry : futures.entrySet()) {
            String name = entry.getKey().getName();
            Future<List<Alert>> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                candidates.addAll(future.get(remaining, TimeUnit.MILLISECONDS));
                if (!entry.getKey().getStatus().isLastSucceeded()) {
                    failedCollectors.add(name);
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                failedCollectors.add(name);
                log.warn("采集器 {} 执行超时，本轮跳过", name);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                failedCollectors.add(name);
                log.warn("等待采集器 {} 时被中断", name);
            } catch (ExecutionException e) {
                failedCollectors.add(name);
                log.warn("采集器 {} 执行异常，本轮跳过", name, e.getCause());
            }
        }
        return candidates;
    }

    /**
     * 接受后到写入前可能已被人工恢复，此时不再写入未恢复快照
     */
    private boolean stillActive(Alert alert) {
        boolean active = store.get(alert.getId()).isPresent();
        if (!active) {
            log.debug("告警在写入前已恢复，跳过快照写入: {}", alert.getId());
        }
        return active;
    }

    private void runPatternLearning() {
        AlertingProperties.MlEnhancement ml = properties.getMlEnhancement();
        if (!ml.isEnabled() || !ml.isPatternLearning()) {
            return;
        }
        try {
            List<Alert> history = store.historySnapshot();
            int from = Math.max(0, history.size() - LEARNING_HISTORY_SIZE);
            patternLearner.learn(history.subList(from, history.size()));
        } catch (RuntimeException e) {
            log.warn("告警模式学习失败", e);
        }
    }

    private void runEscalation() {
        if (!properties.getNotificationSettings().isEscalationEnabled()) {
            return;
        }
        try {
            lifecycleManager.handleEscalations();
        } catch (RuntimeException e) {
            log.warn("告警升级检查失败", e);
        }
    }

    public List<AlertCollector> getCollectors() {
        return collectors;
    }
}
