package com.wangbin.alerting.core.persistence;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.exception.AlertingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static com.wangbin.alerting.support.TestAlerts.alert;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisAlertRepositoryTest {

    private static final String KEY = "alerting:alerts";
    private static final String RESOLVED_KEY = "alerting:alerts:resolved";

    private HashOperations<String, String, Alert> hashOps;
    private RedisAlertRepository repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        RedisTemplate<String, Alert> redisTemplate = mock(RedisTemplate.class);
        hashOps = mock(HashOperations.class);
        when(redisTemplate.<String, Alert>opsForHash()).thenReturn(hashOps);
        repository = new RedisAlertRepository(redisTemplate, KEY);
    }

    @Test
    void upsertWritesHashFieldById() {
        Alert alert = alert(AlertType.PERFORMANCE, "error_rate", AlertSeverity.HIGH, Instant.parse("2024-05-01T10:00:00Z"));

        repository.upsert(alert);

        verify(hashOps).put(KEY, alert.getId(), alert);
    }

    @Test
    void resolvedAlertMovesToResolvedHash() {
        Alert alert = alert(AlertType.PERFORMANCE, "error_rate", AlertSeverity.HIGH, Instant.parse("2024-05-01T10:00:00Z"));
        alert.setResolved(true);

        repository.upsert(alert);

        verify(hashOps).put(RESOLVED_KEY, alert.getId(), alert);
        verify(hashOps).delete(KEY, alert.getId());
    }

    @Test
    void unresolvedSnapshotOfResolvedAlertIsIgnored() {
        Alert alert = alert(AlertType.PERFORMANCE, "error_rate", AlertSeverity.HIGH, Instant.parse("2024-05-01T10:00:00Z"));
        when(hashOps.hasKey(RESOLVED_KEY, alert.getId())).thenReturn(true);

        repository.upsert(alert);

        verify(hashOps, never()).put(eq(KEY), anyString(), any(Alert.class));
    }

    @Test
    void loadUnresolvedDropsSnapshotsAlreadyResolved() {
        Alert stale = alert(AlertType.PERFORMANCE, "error_rate", AlertSeverity.HIGH, Instant.parse("2024-05-01T10:00:00Z"));
        Alert active = alert(AlertType.ANOMALY, "clicks", AlertSeverity.LOW, Instant.parse("2024-05-01T09:00:00Z"));
        when(hashOps.values(KEY)).thenReturn(List.of(stale, active));
        when(hashOps.keys(RESOLVED_KEY)).thenReturn(Set.of(stale.getId()));

        List<Alert> loaded = repository.loadUnresolved();

        assertEquals(List.of(active), loaded);
        verify(hashOps).delete(KEY, stale.getId());
    }

    @Test
    void loadUnresolvedFiltersAndSortsByTimestamp() {
        Alert later = alert(AlertType.PERFORMANCE, "error_rate", AlertSeverity.HIGH, Instant.parse("2024-05-01T10:00:00Z"));
        Alert earlier = alert(AlertType.ANOMALY, "clicks", AlertSeverity.LOW, Instant.parse("2024-05-01T09:00:00Z"));
        Alert resolved = alert(AlertType.BUSINESS, "revenue", AlertSeverity.MEDIUM, Instant.parse("2024-05-01T08:00:00Z"));
        resolved.setResolved(true);
        when(hashOps.values(KEY)).thenReturn(Arrays.asList(later, null, resolved, earlier));

        List<Alert> loaded = repository.loadUnresolved();

        assertEquals(List.of(earlier, later), loaded);
    }

    @Test
    void redisFailureBecomesPersistenceFailure() {
        doThrow(new RedisConnectionFailureException("refused")).when(hashOps).put(eq(KEY), anyString(), any(Alert.class));

        AlertingException e = assertThrows(AlertingException.class,
                () -> repository.upsert(alert(AlertType.WORKFLOW, "workflow_failure_rate", AlertSeverity.CRITICAL, Instant.now())));
        assertEquals(AlertingException.ErrorKind.PERSISTENCE_FAILURE, e.getKind());
        assertEquals("redis", e.getComponent());
    }
}
