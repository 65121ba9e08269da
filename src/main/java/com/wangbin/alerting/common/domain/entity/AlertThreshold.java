package com.wangbin.alerting.common.domain.entity;

import com.wangbin.alerting.common.domain.enums.ThresholdLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 指标阈值定义
 *
 * 未设置的边界表示该方向不做限制；critical 边界必须比同方向的 warning 边界更极端。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertThreshold {

    private String metric;

    private Double warningMin;

    private Double warningMax;

    private Double criticalMin;

    private Double criticalMax;

    @Builder.Default
    private boolean enabled = true;

    /**
     * 自动恢复超时（分钟），为空表示不自动恢复
     */
    private Integer autoResolveTimeout;

    /**
     * 校验阈值配置，返回问题列表，空列表表示合法
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (metric == null || metric.isBlank()) {
            problems.add("metric不能为空");
        }
        if (warningMax != null && criticalMax != null && criticalMax <= warningMax) {
            problems.add("criticalMax(" + criticalMax + ")必须大于warningMax(" + warningMax + ")");
        }
        if (warningMin != null && criticalMin != null && criticalMin >= warningMin) {
            problems.add("criticalMin(" + criticalMin + ")必须小于warningMin(" + warningMin + ")");
        }
        if (autoResolveTimeout != null && autoResolveTimeout <= 0) {
            problems.add("autoResolveTimeout必须为正数");
        }
        return problems;
    }

    public boolean isValid() {
        return validate().isEmpty();
    }

    /**
     * 判断数值是否越界，critical 优先于 warning
     */
    public Optional<ThresholdBreach> evaluate(double value) {
        if (!enabled || Double.isNaN(value)) {
            return Optional.empty();
        }
        if (criticalMax != null && value > criticalMax) {
            return Optional.of(new ThresholdBreach(ThresholdLevel.CRITICAL, criticalMax));
        }
        if (criticalMin != null && value < criticalMin) {
            return Optional.of(new ThresholdBreach(ThresholdLevel.CRITICAL, criticalMin));
        }
        if (warningMax != null && value > warningMax) {
            return Optional.of(new ThresholdBreach(ThresholdLevel.WARNING, warningMax));
        }
        if (warningMin != null && value < warningMin) {
            return Optional.of(new ThresholdBreach(ThresholdLevel.WARNING, warningMin));
        }
        return Optional.empty();
    }

    /**
     * 合并局部更新，返回新实例，原对象不变
     */
    public AlertThreshold merge(ThresholdPatch patch) {
        if (patch == null) {
            return this.toBuilder().build();
        }
        return this.toBuilder()
                .warningMin(patch.getWarningMin() != null ? patch.getWarningMin() : warningMin)
                .warningMax(patch.getWarningMax() != null ? patch.getWarningMax() : warningMax)
                .criticalMin(patch.getCriticalMin() != null ? patch.getCriticalMin() : criticalMin)
                .criticalMax(patch.getCriticalMax() != null ? patch.getCriticalMax() : criticalMax)
                .enabled(patch.getEnabled() != null ? patch.getEnabled() : enabled)
                .autoResolveTimeout(patch.getAutoResolveTimeout() != null
                        ? patch.getAutoResolveTimeout() : autoResolveTimeout)
                .build();
    }
}
