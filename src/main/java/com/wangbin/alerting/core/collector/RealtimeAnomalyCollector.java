package com.wangbin.alerting.core.collector;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.domain.enums.MetricCategory;
import com.wangbin.alerting.core.config.AlertingProperties;
import com.wangbin.alerting.core.detector.AnomalyDetector;
import com.wangbin.alerting.core.detector.AnomalyVerdict;
import com.wangbin.alerting.core.source.MetricRow;
import com.wangbin.alerting.core.source.MetricSource;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 实时指标统计异常采集器
 *
 * 拉取营销数据最近 24 小时的记录，逐个指标抽取正数序列交给 {@link AnomalyDetector}。
 */
public class RealtimeAnomalyCollector extends AbstractAlertCollector {

    private final AnomalyDetector anomalyDetector;
    private final AlertingProperties properties;

    public RealtimeAnomalyCollector(MetricSource metricSource, AnomalyDetector anomalyDetector,
                                    AlertingProperties properties, Clock clock) {
        super("realtime_monitor", "realtime", AlertType.ANOMALY, metricSource, clock);
        this.anomalyDetector = anomalyDetector;
        this.properties = properties;
    }

    @Override
    protected List<Alert> doCollect() {
        AlertingProperties.AnomalyDetection config = properties.getAnomalyDetection();
        if (!config.isEnabled()) {
            return List.of();
        }

        List<MetricRow> rows = metricSource.query(MetricCategory.MARKETING, config.getLookback());
        List<Alert> alerts = new ArrayList<>();
        for (String metric : config.getMetrics()) {
            List<Double> values = extractSeries(rows, metric);
            if (values.size() < config.getMinDataPoints()) {
                continue;
            }
            Optional<AnomalyVerdict> verdict = anomalyDetector.detect(metric, values, config);
            verdict.ifPresent(v -> alerts.add(toAlert(v)));
        }
        return alerts;
    }

    /**
     * 缺失值按 0 处理后过滤掉非正数
     */
    static List<Double> extractSeries(List<MetricRow> rows, String metric) {
        List<Double> values = new ArrayList<>(rows.size());
        for (MetricRow row : rows) {
            double value = row.getDouble(metric, 0);
            if (value > 0) {
                values.add(value);
            }
        }
        return values;
    }

    private Alert toAlert(AnomalyVerdict verdict) {
        Alert alert = newAlert(verdict.getMetric(), verdict.getSeverity())
                .title("Anomaly detected in " + verdict.getMetric())
                .message(verdict.getMessage())
                .currentValue(verdict.getCurrentValue())
                .expectedValue(verdict.getExpectedValue())
                .confidence(verdict.getConfidence())
                .suggestedActions(new ArrayList<>(verdict.getSuggestedActions()))
                .build();
        alert.addMetadata("detection_method", "statistical_analysis");
        alert.addMetadata("data_points", verdict.getSampleSize());
        alert.addMetadata("z_score", verdict.getZScore());
        alert.addMetadata("std_dev", verdict.getStandardDeviation());
        return alert;
    }
}
