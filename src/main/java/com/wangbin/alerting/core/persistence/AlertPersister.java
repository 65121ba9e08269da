package com.wangbin.alerting.core.persistence;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.core.config.AlertingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 尽力而为的持久化通道
 *
 * 仓储调用放到独立线程池执行并限时等待，失败或超时只记日志，
 * 不影响告警在内存活动集合中的有效性。
 */
@Slf4j
@Component
public class AlertPersister {

    private final AlertRepository repository;
    private final ExecutorService executor;
    private final AlertingProperties properties;

    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();

    public AlertPersister(AlertRepository repository,
                          @Qualifier("persistenceExecutor") ExecutorService executor,
                          AlertingProperties properties) {
        this.repository = repository;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * 写入告警快照
     *
     * @return 写入成功返回 true
     */
    public boolean persist(Alert alert) {
        Alert snapshot = alert.copy();
        try {
            await(executor.submit(() -> {
                repository.upsert(snapshot);
                return null;
            }));
            successCount.incrementAndGet();
            return true;
        } catch (TimeoutException e) {
            failureCount.incrementAndGet();
            log.warn("告警持久化超时: {} [{}]", snapshot.getId(), repository.getName());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failureCount.incrementAndGet();
            log.warn("告警持久化被中断: {}", snapshot.getId());
            return false;
        } catch (ExecutionException e) {
            failureCount.incrementAndGet();
            log.warn("告警持久化失败: {} [{}]", snapshot.getId(), repository.getName(), e.getCause());
            return false;
        }
    }

    /**
     * 加载未恢复的告警，失败时返回空列表
     */
    public List<Alert> loadUnresolved() {
        try {
            List<Alert> alerts = await(executor.submit(repository::loadUnresolved));
            log.info("从 {} 仓储加载未恢复告警 {} 条", repository.getName(), alerts.size());
            return alerts;
        } catch (TimeoutException e) {
            log.warn("加载未恢复告警超时 [{}]", repository.getName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("加载未恢复告警被中断");
        } catch (ExecutionException e) {
            log.warn("加载未恢复告警失败 [{}]", repository.getName(), e.getCause());
        }
        return List.of();
    }

    private <T> T await(Future<T> future) throws InterruptedException, ExecutionException, TimeoutException {
        Duration timeout = properties.getPersistence().getTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    public long getSuccessCount() {
        return successCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    public String getRepositoryName() {
        return repository.getName();
    }
}
