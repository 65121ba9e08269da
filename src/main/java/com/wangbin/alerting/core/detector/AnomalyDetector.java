package com.wangbin.alerting.core.detector;

import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.core.config.AlertingProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 基于 z-score 的统计异常检测，无状态
 *
 * 最后一个样本为当前值，之前的样本为历史窗口；
 * 检测阈值 t = sensitivity / 2，z > 2t 为 critical，z > 1.5t 为 high，其余为 medium。
 */
@Component
public class AnomalyDetector {

    private static final double MAX_CONFIDENCE = 0.95;

    public Optional<AnomalyVerdict> detect(String metric, List<Double> samples,
                                           AlertingProperties.AnomalyDetection config) {
        if (samples == null || samples.size() < Math.max(2, config.getMinDataPoints())) {
            return Optional.empty();
        }

        int historySize = samples.size() - 1;
        double current = samples.get(historySize);

        double sum = 0;
        for (int i = 0; i < historySize; i++) {
            sum += samples.get(i);
        }
        double mean = sum / historySize;

        double squares = 0;
        for (int i = 0; i < historySize; i++) {
            double diff = samples.get(i) - mean;
            squares += diff * diff;
        }
        double stdDev = Math.sqrt(squares / historySize);

        // 方差为0时无法计算 z-score，按无异常处理
        if (stdDev == 0 || Double.isNaN(stdDev) || Double.isNaN(current)) {
            return Optional.empty();
        }

        double zScore = Math.abs(current - mean) / stdDev;
        double threshold = config.detectionThreshold();
        if (zScore <= threshold) {
            return Optional.empty();
        }

        return Optional.of(AnomalyVerdict.builder()
                .metric(metric)
                .severity(classify(zScore, threshold))
                .message(String.format(Locale.ROOT, "%s value %s deviates %.2f standard deviations from normal",
                        metric, formatValue(current), zScore))
                .currentValue(current)
                .expectedValue(mean)
                .standardDeviation(stdDev)
                .confidence(confidence(zScore, threshold))
                .zScore(zScore)
                .sampleSize(samples.size())
                .suggestedActions(List.of(
                        "Investigate " + metric + " patterns",
                        "Check for external factors",
                        "Review recent changes",
                        "Monitor trend continuation"))
                .build());
    }

    static AlertSeverity classify(double zScore, double threshold) {
        if (zScore > threshold * 2) {
            return AlertSeverity.CRITICAL;
        }
        if (zScore > threshold * 1.5) {
            return AlertSeverity.HIGH;
        }
        return AlertSeverity.MEDIUM;
    }

    static double confidence(double zScore, double threshold) {
        return Math.min(MAX_CONFIDENCE, (zScore / threshold) * 0.5);
    }

    private static String formatValue(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
