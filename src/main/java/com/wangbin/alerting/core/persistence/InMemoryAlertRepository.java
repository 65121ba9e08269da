package com.wangbin.alerting.core.persistence;

import com.wangbin.alerting.common.domain.entity.Alert;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内告警仓储，保存写入时的拷贝
 */
@Slf4j
public class InMemoryAlertRepository implements AlertRepository {

    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();

    @Override
    public void upsert(Alert alert) {
        alerts.compute(alert.getId(), (id, existing) -> {
            if (existing != null && existing.isResolved() && !alert.isResolved()) {
                log.debug("忽略已恢复告警的旧快照: {}", id);
                return existing;
            }
            return alert.copy();
        });
    }

    @Override
    public List<Alert> loadUnresolved() {
        return alerts.values().stream()
                .filter(alert -> !alert.isResolved())
                .sorted(Comparator.comparing(Alert::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(Alert::copy)
                .toList();
    }

    public Optional<Alert> findById(String id) {
        return Optional.ofNullable(alerts.get(id)).map(Alert::copy);
    }

    public int size() {
        return alerts.size();
    }

    @Override
    public String getName() {
        return "memory";
    }
}
