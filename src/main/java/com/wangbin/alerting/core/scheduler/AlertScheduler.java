package com.wangbin.alerting.core.scheduler;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.exception.AlertingException;
import com.wangbin.alerting.core.config.AlertingProperties;
import com.wangbin.alerting.core.lifecycle.AlertLifecycleManager;
import com.wangbin.alerting.core.persistence.AlertPersister;
import com.wangbin.alerting.core.pipeline.ActiveAlertStore;
import com.wangbin.alerting.core.pipeline.AlertPipeline;
import com.wangbin.alerting.core.pipeline.TickReport;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 告警调度器
 *
 * 驱动两个周期任务：流水线（update-interval）和清理（cleanup-interval）。
 * 流水线采用固定延迟调度并配合执行标记，同一时刻最多一轮在执行。
 * start/stop 只控制后续是否调度，不取消正在执行的轮次。
 */
@Slf4j
@Component
public class AlertScheduler {

    private final ScheduledExecutorService scheduler;
    private final AlertPipeline pipeline;
    private final AlertLifecycleManager lifecycleManager;
    private final ActiveAlertStore store;
    private final AlertPersister persister;
    private final AlertingProperties properties;

    private final AtomicBoolean ticking = new AtomicBoolean(false);
    private final AtomicBoolean warmedUp = new AtomicBoolean(false);
    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong failedTickCount = new AtomicLong();
    private final AtomicLong skippedTickCount = new AtomicLong();

    private ScheduledFuture<?> tickFuture;
    private ScheduledFuture<?> cleanupFuture;
    private volatile boolean running;
    private volatile TickReport lastTickReport;
    private volatile Instant startedAt;

    public AlertScheduler(@Qualifier("alertSchedulerExecutor") ScheduledExecutorService scheduler,
                          AlertPipeline pipeline, AlertLifecycleManager lifecycleManager,
                          ActiveAlertStore store, AlertPersister persister, AlertingProperties properties) {
        this.scheduler = scheduler;
        this.pipeline = pipeline;
        this.lifecycleManager = lifecycleManager;
        this.store = store;
        this.persister = persister;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isAutoStart()) {
            log.info("告警引擎未配置自动启动，等待手动启动");
            return;
        }
        try {
            start();
        } catch (AlertingException e) {
            log.error("告警引擎自动启动失败", e);
        }
    }

    /**
     * 启动调度，重复调用无副作用
     *
     * @return 本次调用是否真正启动了调度
     * @throws AlertingException 调度任务无法提交时抛出
     */
    public synchronized boolean start() {
        if (running) {
            return false;
        }
        if (!properties.isEnabled()) {
            log.warn("告警引擎已禁用 (alerting.enabled=false)，不启动调度");
            return false;
        }

        warmUp();

        Duration interval = properties.getUpdateInterval();
        Duration cleanupInterval = properties.getCleanupInterval();
        try {
            tickFuture = scheduler.scheduleWithFixedDelay(this::tick,
                    0, interval.toMillis(), TimeUnit.MILLISECONDS);
            cleanupFuture = scheduler.scheduleWithFixedDelay(this::cleanup,
                    cleanupInterval.toMillis(), cleanupInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            cancelFutures();
            throw AlertingException.schedulerFailure("告警调度任务提交失败", e);
        }

        running = true;
        startedAt = Instant.now();
        log.info("告警引擎已启动，流水线间隔 {}，清理间隔 {}", interval, cleanupInterval);
        return true;
    }

    /**
     * 停止调度，正在执行的轮次会继续完成
     */
    public synchronized boolean stop() {
        if (!running) {
            return false;
        }
        cancelFutures();
        running = false;
        log.info("告警引擎已停止");
        return true;
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    /**
     * 立即执行一轮流水线；已有轮次在执行时跳过
     */
    public Optional<TickReport> runOnce() {
        if (!ticking.compareAndSet(false, true)) {
            skippedTickCount.incrementAndGet();
            log.debug("上一轮告警流水线仍在执行，本次跳过");
            return Optional.empty();
        }
        try {
            TickReport report = pipeline.runTick();
            lastTickReport = report;
            tickCount.incrementAndGet();
            return Optional.of(report);
        } catch (RuntimeException e) {
            failedTickCount.incrementAndGet();
            log.error("告警流水线执行失败", e);
            return Optional.empty();
        } finally {
            ticking.set(false);
        }
    }

    void tick() {
        runOnce();
    }

    void cleanup() {
        try {
            lifecycleManager.cleanup();
        } catch (RuntimeException e) {
            log.error("告警清理任务执行失败", e);
        }
    }

    private void warmUp() {
        if (!warmedUp.compareAndSet(false, true)) {
            return;
        }
        List<Alert> unresolved = persister.loadUnresolved();
        int loaded = store.warm(unresolved);
        if (loaded > 0) {
            log.info("活动告警预热完成，加载 {} 条", loaded);
        }
    }

    private void cancelFutures() {
        if (tickFuture != null) {
            tickFuture.cancel(false);
            tickFuture = null;
        }
        if (cleanupFuture != null) {
            cleanupFuture.cancel(false);
            cleanupFuture = null;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isTicking() {
        return ticking.get();
    }

    public TickReport getLastTickReport() {
        return lastTickReport;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getTickCount() {
        return tickCount.get();
    }

    public long getFailedTickCount() {
        return failedTickCount.get();
    }

    public long getSkippedTickCount() {
        return skippedTickCount.get();
    }
}
