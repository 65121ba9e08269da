package com.wangbin.alerting.core.pipeline;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.core.config.AlertingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 活动告警集合与告警历史
 *
 * 流水线写入、生命周期变更和清理都通过同一把锁互斥。
 * {@link #get(String)} 与 {@link #activeAlerts()} 返回的是内部对象，只能在 {@link #withLock} 内读写；
 * 对外展示使用 {@link #snapshot()} 等拷贝方法。
 */
@Slf4j
@Component
public class ActiveAlertStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Alert> active = new LinkedHashMap<>();
    private final ArrayDeque<Alert> history = new ArrayDeque<>();
    private final int historyLimit;

    public ActiveAlertStore(AlertingProperties properties) {
        this.historyLimit = properties.getHistorySize();
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 接受新告警：写入活动集合并追加到历史
     */
    public void add(Alert alert) {
        withLock(() -> {
            active.put(alert.getId(), alert);
            if (history.size() >= historyLimit) {
                history.removeFirst();
            }
            history.addLast(alert);
        });
    }

    /**
     * 启动预热，只写入活动集合
     */
    public int warm(List<Alert> alerts) {
        return withLock(() -> {
            int loaded = 0;
            for (Alert alert : alerts) {
                if (alert.getId() != null && !alert.isResolved() && active.putIfAbsent(alert.getId(), alert) == null) {
                    loaded++;
                }
            }
            return loaded;
        });
    }

    public Optional<Alert> get(String id) {
        return withLock(() -> Optional.ofNullable(active.get(id)));
    }

    public Optional<Alert> remove(String id) {
        return withLock(() -> Optional.ofNullable(active.remove(id)));
    }

    public List<Alert> activeAlerts() {
        return withLock(() -> new ArrayList<>(active.values()));
    }

    public List<Alert> snapshot() {
        return withLock(() -> active.values().stream().map(Alert::copy).toList());
    }

    public List<Alert> historySnapshot() {
        return withLock(() -> history.stream().map(Alert::copy).toList());
    }

    public long resolvedInHistory() {
        return withLock(() -> history.stream().filter(Alert::isResolved).count());
    }

    public int size() {
        return withLock(active::size);
    }
}
