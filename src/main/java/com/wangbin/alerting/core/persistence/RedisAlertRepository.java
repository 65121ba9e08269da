package com.wangbin.alerting.core.persistence;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.exception.AlertingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Redis 告警仓储
 *
 * 未恢复告警保存在 key 对应的 hash，已恢复告警移入 key:resolved，field 均为告警 ID。
 * 已恢复 hash 只增不减，加载时以它为准过滤，写入顺序交错也不会让已恢复告警重新变为活动。
 */
@Slf4j
public class RedisAlertRepository implements AlertRepository {

    private static final String RESOLVED_SUFFIX = ":resolved";

    private final RedisTemplate<String, Alert> redisTemplate;
    private final String key;
    private final String resolvedKey;

    public RedisAlertRepository(RedisTemplate<String, Alert> redisTemplate, String key) {
        this.redisTemplate = redisTemplate;
        this.key = key;
        this.resolvedKey = key + RESOLVED_SUFFIX;
    }

    @Override
    public void upsert(Alert alert) {
        String id = alert.getId();
        try {
            HashOperations<String, String, Alert> ops = hashOps();
            if (alert.isResolved()) {
                ops.put(resolvedKey, id, alert);
                ops.delete(key, id);
                return;
            }
            if (Boolean.TRUE.equals(ops.hasKey(resolvedKey, id))) {
                log.debug("忽略已恢复告警的旧快照: {}", id);
                return;
            }
            ops.put(key, id, alert);
        } catch (DataAccessException e) {
            throw AlertingException.persistenceFailure(getName(), "写入告警失败: " + id, e);
        }
    }

    @Override
    public List<Alert> loadUnresolved() {
        try {
            HashOperations<String, String, Alert> ops = hashOps();
            Set<String> resolvedIds = ops.keys(resolvedKey);
            List<Alert> unresolved = new ArrayList<>();
            List<String> stale = new ArrayList<>();
            for (Alert alert : ops.values(key)) {
                if (alert == null || alert.isResolved()) {
                    continue;
                }
                if (resolvedIds.contains(alert.getId())) {
                    stale.add(alert.getId());
                    continue;
                }
                unresolved.add(alert);
            }
            if (!stale.isEmpty()) {
                ops.delete(key, stale.toArray());
                log.info("清除已恢复告警的残留快照 {} 条", stale.size());
            }
            unresolved.sort(Comparator.comparing(Alert::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder())));
            return unresolved;
        } catch (DataAccessException e) {
            throw AlertingException.persistenceFailure(getName(), "加载未恢复告警失败", e);
        }
    }

    private HashOperations<String, String, Alert> hashOps() {
        return redisTemplate.opsForHash();
    }

    @Override
    public String getName() {
        return "redis";
    }
}
