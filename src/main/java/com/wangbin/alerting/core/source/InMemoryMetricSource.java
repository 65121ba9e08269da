package com.wangbin.alerting.core.source;

import com.wangbin.alerting.common.domain.enums.MetricCategory;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 内存指标数据源，数据通过 {@link #append} 推入，超过保留时长的行在写入时清理
 */
@Slf4j
public class InMemoryMetricSource implements MetricSource {

    private final Map<MetricCategory, CopyOnWriteArrayList<MetricRow>> rows = new EnumMap<>(MetricCategory.class);
    private final Clock clock;
    private final Duration retention;

    public InMemoryMetricSource(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention;
        for (MetricCategory category : MetricCategory.values()) {
            rows.put(category, new CopyOnWriteArrayList<>());
        }
    }

    public void append(MetricCategory category, MetricRow row) {
        if (row.getTimestamp() == null) {
            row.setTimestamp(clock.instant());
        }
        CopyOnWriteArrayList<MetricRow> list = rows.get(category);
        list.add(row);
        Instant expireBefore = clock.instant().minus(retention);
        list.removeIf(existing -> existing.getTimestamp().isBefore(expireBefore));
    }

    public void append(MetricCategory category, Map<String, ?> fields) {
        append(category, MetricRow.of(clock.instant(), fields));
    }

    public void clear() {
        rows.values().forEach(List::clear);
    }

    public Map<MetricCategory, Integer> sizes() {
        Map<MetricCategory, Integer> sizes = new EnumMap<>(MetricCategory.class);
        for (Entry<MetricCategory, CopyOnWriteArrayList<MetricRow>> entry : rows.entrySet()) {
            sizes.put(entry.getKey(), entry.getValue().size());
        }
        return sizes;
    }

    @Override
    public List<MetricRow> query(MetricCategory category, Duration window) {
        Instant since = clock.instant().minus(window);
        List<MetricRow> result = new ArrayList<>();
        for (MetricRow row : rows.get(category)) {
            if (!row.getTimestamp().isBefore(since)) {
                result.add(row);
            }
        }
        result.sort(Comparator.comparing(MetricRow::getTimestamp));
        return result;
    }

    @Override
    public String getName() {
        return "memory";
    }
}
