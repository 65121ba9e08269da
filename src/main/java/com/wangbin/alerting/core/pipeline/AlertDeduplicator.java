package com.wangbin.alerting.core.pipeline;

import com.wangbin.alerting.common.domain.entity.Alert;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * 重复告警判定：活动集合中存在 (类型, 指标, 级别) 相同、一小时内创建且未恢复的告警
 */
@Component
public class AlertDeduplicator {

    static final Duration WINDOW = Duration.ofHours(1);

    private final Clock clock;

    public AlertDeduplicator(Clock clock) {
        this.clock = clock;
    }

    public boolean isDuplicate(Alert candidate, Collection<Alert> activeAlerts) {
        Instant windowStart = clock.instant().minus(WINDOW);
        String key = candidate.dedupKey();
        for (Alert existing : activeAlerts) {
            if (!existing.isResolved()
                    && existing.getTimestamp() != null
                    && existing.getTimestamp().isAfter(windowStart)
                    && key.equals(existing.dedupKey())) {
                return true;
            }
        }
        return false;
    }
}
