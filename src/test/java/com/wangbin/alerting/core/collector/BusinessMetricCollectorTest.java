package com.wangbin.alerting.core.collector;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.domain.enums.MetricCategory;
import com.wangbin.alerting.core.config.AlertingProperties;
import com.wangbin.alerting.core.registry.ThresholdRegistry;
import com.wangbin.alerting.core.source.InMemoryMetricSource;
import com.wangbin.alerting.core.source.MetricRow;
import com.wangbin.alerting.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BusinessMetricCollectorTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private final InMemoryMetricSource source = new InMemoryMetricSource(clock, Duration.ofHours(48));
    private final BusinessMetricCollector collector =
            new BusinessMetricCollector(source, new ThresholdRegistry(new AlertingProperties()), clock);

    private void aggregate(String at, Map<String, ?> fields) {
        source.append(MetricCategory.DAILY_AGGREGATE, MetricRow.of(Instant.parse(at), fields));
    }

    @Test
    void lowRevenueIsMediumAndNeverAutoResolves() {
        aggregate("2024-05-01T09:00:00Z", Map.of("total_revenue", 800, "total_conversions", 50, "total_sessions", 1000));

        List<Alert> alerts = collector.collect();

        assertEquals(1, alerts.size());
        Alert alert = alerts.get(0);
        assertEquals(AlertType.BUSINESS, alert.getType());
        assertEquals(ThresholdRegistry.REVENUE, alert.getMetric());
        assertEquals(AlertSeverity.MEDIUM, alert.getSeverity());
        assertEquals(1000.0, alert.getThreshold());
        assertEquals("Today's revenue (800) is below threshold", alert.getMessage());
        assertFalse(alert.isAutoResolve());
        assertEquals("2024-05-01", alert.getMetadataValue("date"));
    }

    @Test
    void revenueBelowCriticalBoundIsCritical() {
        aggregate("2024-05-01T09:00:00Z", Map.of("total_revenue", 400));

        Alert alert = collector.collect().get(0);

        assertEquals(AlertSeverity.CRITICAL, alert.getSeverity());
    }

    @Test
    void lowConversionRateIsHigh() {
        aggregate("2024-05-01T09:00:00Z", Map.of("total_revenue", 5000, "total_conversions", 15, "total_sessions", 1000));

        List<Alert> alerts = collector.collect();

        assertEquals(1, alerts.size());
        Alert alert = alerts.get(0);
        assertEquals(ThresholdRegistry.CONVERSION_RATE, alert.getMetric());
        assertEquals(AlertSeverity.HIGH, alert.getSeverity());
        assertEquals(1.5, alert.getCurrentValue(), 1e-9);
        assertEquals(0.85, alert.getConfidence(), 1e-9);
    }

    @Test
    void zeroSessionsSkipsConversionCheck() {
        aggregate("2024-05-01T09:00:00Z", Map.of("total_revenue", 5000, "total_conversions", 0, "total_sessions", 0));

        assertTrue(collector.collect().isEmpty());
    }

    @Test
    void onlyTodaysLatestAggregateCounts() {
        aggregate("2024-04-30T23:00:00Z", Map.of("total_revenue", 10));
        aggregate("2024-05-01T08:00:00Z", Map.of("total_revenue", 10));
        aggregate("2024-05-01T09:30:00Z", Map.of("total_revenue", 5000));

        assertTrue(collector.collect().isEmpty());
    }
}
