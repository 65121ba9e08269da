package com.wangbin.alerting.core.registry;

import com.wangbin.alerting.common.domain.entity.AlertThreshold;
import com.wangbin.alerting.common.domain.entity.ThresholdPatch;
import com.wangbin.alerting.core.config.AlertingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 指标阈值注册表
 *
 * 启动时加载内置默认阈值，再叠加配置中的覆盖项；非法覆盖项被丢弃并保留默认值。
 * 运行期只允许更新已存在的指标（不做 upsert）。
 */
@Slf4j
@Component
public class ThresholdRegistry {

    public static final String REVENUE = "revenue";
    public static final String CONVERSION_RATE = "conversion_rate";
    public static final String RESPONSE_TIME = "response_time";
    public static final String ERROR_RATE = "error_rate";

    private final Map<String, AlertThreshold> thresholds = new ConcurrentHashMap<>();

    public ThresholdRegistry(AlertingProperties properties) {
        defaultThresholds().forEach(threshold -> thresholds.put(threshold.getMetric(), threshold));
        applyOverrides(properties.getThresholds());
        log.info("阈值注册表初始化完成，共 {} 个指标", thresholds.size());
    }

    public Optional<AlertThreshold> get(String metric) {
        if (metric == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(thresholds.get(metric));
    }

    public List<AlertThreshold> getAll() {
        List<AlertThreshold> all = new ArrayList<>(thresholds.values());
        all.sort(Comparator.comparing(AlertThreshold::getMetric));
        return all;
    }

    /**
     * 合并局部更新到已有阈值
     *
     * @return 指标不存在或合并结果不合法时返回 false，注册表不变
     */
    public boolean update(String metric, ThresholdPatch patch) {
        if (metric == null) {
            return false;
        }
        boolean[] updated = {false};
        thresholds.computeIfPresent(metric, (key, existing) -> {
            AlertThreshold merged = existing.merge(patch);
            List<String> problems = merged.validate();
            if (!problems.isEmpty()) {
                log.warn("阈值更新被拒绝: {} -> {}", metric, problems);
                return existing;
            }
            updated[0] = true;
            return merged;
        });
        if (updated[0]) {
            log.info("阈值已更新: {}", thresholds.get(metric));
        } else if (!thresholds.containsKey(metric)) {
            log.debug("忽略未知指标的阈值更新: {}", metric);
        }
        return updated[0];
    }

    private void applyOverrides(Collection<AlertingProperties.ThresholdConfig> overrides) {
        if (overrides == null) {
            return;
        }
        for (AlertingProperties.ThresholdConfig config : overrides) {
            AlertThreshold candidate = AlertThreshold.builder()
                    .metric(config.getMetric())
                    .warningMin(config.getWarningMin())
                    .warningMax(config.getWarningMax())
                    .criticalMin(config.getCriticalMin())
                    .criticalMax(config.getCriticalMax())
                    .enabled(config.isEnabled())
                    .autoResolveTimeout(config.getAutoResolveTimeout())
                    .build();
            List<String> problems = candidate.validate();
            if (!problems.isEmpty()) {
                log.warn("阈值配置无效，保留默认值: {} -> {}", config.getMetric(), problems);
                continue;
            }
            thresholds.put(candidate.getMetric(), candidate);
        }
    }

    static List<AlertThreshold> defaultThresholds() {
        return List.of(
                AlertThreshold.builder().metric(REVENUE)
                        .warningMin(1000d).criticalMin(500d).autoResolveTimeout(60).build(),
                AlertThreshold.builder().metric(CONVERSION_RATE)
                        .warningMin(2.0).criticalMin(1.0).autoResolveTimeout(30).build(),
                AlertThreshold.builder().metric(RESPONSE_TIME)
                        .warningMax(2000d).criticalMax(5000d).autoResolveTimeout(15).build(),
                AlertThreshold.builder().metric(ERROR_RATE)
                        .warningMax(5d).criticalMax(10d).autoResolveTimeout(10).build()
        );
    }
}
