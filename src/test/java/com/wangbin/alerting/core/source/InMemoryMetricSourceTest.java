package com.wangbin.alerting.core.source;

import com.wangbin.alerting.common.domain.enums.MetricCategory;
import com.wangbin.alerting.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMetricSourceTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private final InMemoryMetricSource source = new InMemoryMetricSource(clock, Duration.ofHours(2));

    @Test
    void queryReturnsRowsInsideWindowInTimeOrder() {
        source.append(MetricCategory.SYSTEM, MetricRow.of(Instant.parse("2024-05-01T09:50:00Z"), Map.of("response_time", 2)));
        source.append(MetricCategory.SYSTEM, MetricRow.of(Instant.parse("2024-05-01T09:30:00Z"), Map.of("response_time", 1)));
        source.append(MetricCategory.SYSTEM, MetricRow.of(Instant.parse("2024-05-01T08:30:00Z"), Map.of("response_time", 0)));
        source.append(MetricCategory.MARKETING, Map.of("clicks", 10));

        List<MetricRow> rows = source.query(MetricCategory.SYSTEM, Duration.ofHours(1));

        assertEquals(List.of(1.0, 2.0), rows.stream().map(r -> r.getDouble("response_time")).toList());
        assertEquals(1, source.query(MetricCategory.MARKETING, Duration.ofMinutes(1)).size());
    }

    @Test
    void rowsBeyondRetentionArePrunedOnAppend() {
        source.append(MetricCategory.WORKFLOW_EXECUTION, Map.of("status", "failed"));
        clock.advance(Duration.ofHours(3));
        source.append(MetricCategory.WORKFLOW_EXECUTION, Map.of("status", "completed"));

        assertEquals(1, source.sizes().get(MetricCategory.WORKFLOW_EXECUTION));
        source.clear();
        assertEquals(0, source.sizes().get(MetricCategory.WORKFLOW_EXECUTION));
    }
}
