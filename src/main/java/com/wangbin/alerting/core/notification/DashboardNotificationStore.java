package com.wangbin.alerting.core.notification;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 控制台通知存储（基于Caffeine）
 *
 * 同一告警的升级通知单独成行，key 为 alertId + 序号。
 */
@Slf4j
@Component
public class DashboardNotificationStore {

    private final Cache<String, DashboardNotification> cache;
    private final AtomicLong sequence = new AtomicLong();

    public DashboardNotificationStore(
            @Value("${alerting.dashboard.max-size:1000}") long maxSize,
            @Value("${alerting.dashboard.expire-after-write:86400}") long expireAfterWrite) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(expireAfterWrite, TimeUnit.SECONDS)
                .build();
        log.info("控制台通知存储初始化完成: maxSize={}, expireAfterWrite={}s", maxSize, expireAfterWrite);
    }

    public void insert(DashboardNotification notification) {
        cache.put(notification.getAlertId() + "#" + sequence.incrementAndGet(), notification);
    }

    /**
     * 按写入时间倒序返回最近的通知
     */
    public List<DashboardNotification> recent(int limit) {
        return cache.asMap().values().stream()
                .sorted(Comparator.comparing(DashboardNotification::getCreatedAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }
}
