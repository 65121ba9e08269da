package com.wangbin.alerting.core.collector;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.AlertThreshold;
import com.wangbin.alerting.common.domain.entity.ThresholdBreach;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.domain.enums.MetricCategory;
import com.wangbin.alerting.core.registry.ThresholdRegistry;
import com.wangbin.alerting.core.source.MetricRow;
import com.wangbin.alerting.core.source.MetricSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 业务指标采集器：当日营收与转化率
 *
 * 业务类告警需要人工处理，autoResolve 固定为 false。
 */
public class BusinessMetricCollector extends AbstractAlertCollector {

    private final ThresholdRegistry thresholdRegistry;

    public BusinessMetricCollector(MetricSource metricSource, ThresholdRegistry thresholdRegistry, Clock clock) {
        super("business_monitor", "business", AlertType.BUSINESS, metricSource, clock);
        this.thresholdRegistry = thresholdRegistry;
    }

    @Override
    protected List<Alert> doCollect() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        Instant startOfDay = today.atStartOfDay(ZoneOffset.UTC).toInstant();
        Duration sinceMidnight = Duration.between(startOfDay, clock.instant());

        List<MetricRow> rows = metricSource.query(MetricCategory.DAILY_AGGREGATE, sinceMidnight);
        if (rows.isEmpty()) {
            return List.of();
        }
        MetricRow todayMetrics = rows.get(rows.size() - 1);

        List<Alert> alerts = new ArrayList<>(2);
        checkRevenue(todayMetrics, today).ifPresent(alerts::add);
        checkConversionRate(todayMetrics).ifPresent(alerts::add);
        return alerts;
    }

    private Optional<Alert> checkRevenue(MetricRow row, LocalDate today) {
        Double revenue = row.getDouble("total_revenue");
        if (revenue == null) {
            return Optional.empty();
        }
        Optional<AlertThreshold> threshold = thresholdRegistry.get(ThresholdRegistry.REVENUE);
        Optional<ThresholdBreach> breach = threshold.flatMap(t -> t.evaluate(revenue));
        if (breach.isEmpty()) {
            return Optional.empty();
        }
        AlertSeverity severity = breach.get().isCritical() ? AlertSeverity.CRITICAL : AlertSeverity.MEDIUM;
        Alert alert = newAlert(ThresholdRegistry.REVENUE, severity)
                .title("Low revenue alert")
                .message(String.format(Locale.ROOT, "Today's revenue (%s) is below threshold", format(revenue)))
                .currentValue(revenue)
                .threshold(PerformanceAlertCollector.warningOrLimit(threshold.get().getWarningMin(), breach.get()))
                .confidence(0.9)
                .autoResolve(false)
                .suggestedActions(new ArrayList<>(List.of(
                        "Review marketing campaigns",
                        "Check conversion funnels",
                        "Analyze traffic sources",
                        "Consider promotional activities")))
                .build();
        alert.addMetadata("date", today.toString());
        alert.addMetadata("total_revenue", revenue);
        return Optional.of(alert);
    }

    private Optional<Alert> checkConversionRate(MetricRow row) {
        double conversions = row.getDouble("total_conversions", 0);
        double sessions = row.getDouble("total_sessions", 0);
        if (sessions <= 0) {
            return Optional.empty();
        }
        double conversionRate = conversions / sessions * 100;
        Optional<AlertThreshold> threshold = thresholdRegistry.get(ThresholdRegistry.CONVERSION_RATE);
        Optional<ThresholdBreach> breach = threshold.flatMap(t -> t.evaluate(conversionRate));
        if (breach.isEmpty()) {
            return Optional.empty();
        }
        AlertSeverity severity = breach.get().isCritical() ? AlertSeverity.CRITICAL : AlertSeverity.HIGH;
        Alert alert = newAlert(ThresholdRegistry.CONVERSION_RATE, severity)
                .title("Low conversion rate alert")
                .message(String.format(Locale.ROOT, "Conversion rate (%.2f%%) is below threshold", conversionRate))
                .currentValue(conversionRate)
                .threshold(PerformanceAlertCollector.warningOrLimit(threshold.get().getWarningMin(), breach.get()))
                .confidence(0.85)
                .autoResolve(false)
                .suggestedActions(new ArrayList<>(List.of(
                        "A/B test landing pages",
                        "Review checkout process",
                        "Analyze user behavior",
                        "Optimize call-to-actions")))
                .build();
        alert.addMetadata("conversion_rate", conversionRate);
        alert.addMetadata("conversions", conversions);
        alert.addMetadata("sessions", sessions);
        return Optional.of(alert);
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
