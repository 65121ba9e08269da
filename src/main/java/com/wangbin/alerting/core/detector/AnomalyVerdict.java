package com.wangbin.alerting.core.detector;

import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 异常检测结果
 */
@Value
@Builder
public class AnomalyVerdict {
    String metric;
    AlertSeverity severity;
    String message;
    double currentValue;

    /**
     * 历史窗口均值
     */
    double expectedValue;

    double standardDeviation;

    /**
     * 启发式置信度，上限 0.95，并非统计意义上的概率
     */
    double confidence;

    double zScore;

    int sampleSize;

    @Builder.Default
    List<String> suggestedActions = Collections.emptyList();
}
