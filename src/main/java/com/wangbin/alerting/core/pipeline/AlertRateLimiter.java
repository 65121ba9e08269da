package com.wangbin.alerting.core.pipeline;

import com.wangbin.alerting.core.config.AlertingProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 按 (类型, 指标) 的小时级限流
 *
 * 每个键维护计数与窗口起点；窗口超过一小时则清零重开。
 * 上限每次读取配置，修改 max-alerts-per-hour 后下一次判定即生效。
 */
@Component
public class AlertRateLimiter {

    static final Duration WINDOW = Duration.ofHours(1);

    private final AlertingProperties properties;
    private final Clock clock;
    private final Map<String, Window> windows = new HashMap<>();

    public AlertRateLimiter(AlertingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 尝试占用一个配额
     *
     * @return 未超限返回 true 并计数，超限返回 false
     */
    public synchronized boolean tryAcquire(String key) {
        Instant now = clock.instant();
        Window window = windows.computeIfAbsent(key, k -> new Window(now));
        if (!now.isBefore(window.start.plus(WINDOW))) {
            window.start = now;
            window.count = 0;
        }
        if (window.count >= properties.getMaxAlertsPerHour()) {
            return false;
        }
        window.count++;
        return true;
    }

    public synchronized int currentCount(String key) {
        Window window = windows.get(key);
        return window != null ? window.count : 0;
    }

    private static final class Window {
        private Instant start;
        private int count;

        private Window(Instant start) {
            this.start = start;
        }
    }
}
