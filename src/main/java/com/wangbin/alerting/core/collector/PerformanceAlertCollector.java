package com.wangbin.alerting.core.collector;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.AlertThreshold;
import com.wangbin.alerting.common.domain.entity.ThresholdBreach;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.domain.enums.MetricCategory;
import com.wangbin.alerting.core.config.AlertingProperties;
import com.wangbin.alerting.core.registry.ThresholdRegistry;
import com.wangbin.alerting.core.source.MetricRow;
import com.wangbin.alerting.core.source.MetricSource;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 系统性能采集器：平均响应时间与错误率
 */
public class PerformanceAlertCollector extends AbstractAlertCollector {

    private static final Duration WINDOW = Duration.ofHours(1);
    private static final int ERROR_STATUS = 400;

    private final ThresholdRegistry thresholdRegistry;
    private final AlertingProperties properties;

    public PerformanceAlertCollector(MetricSource metricSource, ThresholdRegistry thresholdRegistry,
                                     AlertingProperties properties, Clock clock) {
        super("performance_monitor", "performance", AlertType.PERFORMANCE, metricSource, clock);
        this.thresholdRegistry = thresholdRegistry;
        this.properties = properties;
    }

    @Override
    protected List<Alert> doCollect() {
        List<MetricRow> rows = latest(metricSource.query(MetricCategory.SYSTEM, WINDOW),
                properties.getMetricSource().getPerformanceSampleLimit());
        if (rows.isEmpty()) {
            return List.of();
        }

        double totalResponseTime = 0;
        int errors = 0;
        for (MetricRow row : rows) {
            totalResponseTime += row.getDouble("response_time", 0);
            if (row.getDouble("status_code", 0) >= ERROR_STATUS) {
                errors++;
            }
        }
        double avgResponseTime = totalResponseTime / rows.size();
        double errorRate = errors * 100.0 / rows.size();

        List<Alert> alerts = new ArrayList<>(2);
        checkResponseTime(avgResponseTime, rows.size()).ifPresent(alerts::add);
        checkErrorRate(errorRate, rows.size()).ifPresent(alerts::add);
        return alerts;
    }

    private Optional<Alert> checkResponseTime(double avgResponseTime, int sampleSize) {
        Optional<AlertThreshold> threshold = thresholdRegistry.get(ThresholdRegistry.RESPONSE_TIME);
        Optional<ThresholdBreach> breach = threshold.flatMap(t -> t.evaluate(avgResponseTime));
        if (breach.isEmpty()) {
            return Optional.empty();
        }
        AlertSeverity severity = breach.get().isCritical() ? AlertSeverity.CRITICAL : AlertSeverity.HIGH;
        Alert alert = newAlert(ThresholdRegistry.RESPONSE_TIME, severity)
                .title("High response time detected")
                .message(String.format(Locale.ROOT, "Average response time is %.0fms", avgResponseTime))
                .currentValue(avgResponseTime)
                .threshold(warningOrLimit(threshold.get().getWarningMax(), breach.get()))
                .confidence(0.95)
                .suggestedActions(new ArrayList<>(List.of(
                        "Check server resources",
                        "Review database queries",
                        "Analyze traffic patterns",
                        "Consider scaling resources")))
                .build();
        alert.addMetadata("avg_response_time", avgResponseTime);
        alert.addMetadata("sample_size", sampleSize);
        return Optional.of(alert);
    }

    private Optional<Alert> checkErrorRate(double errorRate, int sampleSize) {
        Optional<AlertThreshold> threshold = thresholdRegistry.get(ThresholdRegistry.ERROR_RATE);
        Optional<ThresholdBreach> breach = threshold.flatMap(t -> t.evaluate(errorRate));
        if (breach.isEmpty()) {
            return Optional.empty();
        }
        AlertSeverity severity = breach.get().isCritical() ? AlertSeverity.CRITICAL : AlertSeverity.HIGH;
        Alert alert = newAlert(ThresholdRegistry.ERROR_RATE, severity)
                .title("High error rate detected")
                .message(String.format(Locale.ROOT, "Error rate is %.1f%%", errorRate))
                .currentValue(errorRate)
                .threshold(warningOrLimit(threshold.get().getWarningMax(), breach.get()))
                .confidence(0.95)
                .suggestedActions(new ArrayList<>(List.of(
                        "Review error logs",
                        "Check external dependencies",
                        "Verify configuration",
                        "Monitor user reports")))
                .build();
        alert.addMetadata("error_rate", errorRate);
        alert.addMetadata("total_requests", sampleSize);
        return Optional.of(alert);
    }

    /**
     * 数据源按时间升序返回，这里取最近的 limit 条
     */
    static List<MetricRow> latest(List<MetricRow> rows, int limit) {
        if (limit <= 0 || rows.size() <= limit) {
            return rows;
        }
        return rows.subList(rows.size() - limit, rows.size());
    }

    static double warningOrLimit(Double warning, ThresholdBreach breach) {
        return warning != null ? warning : breach.limit();
    }
}
