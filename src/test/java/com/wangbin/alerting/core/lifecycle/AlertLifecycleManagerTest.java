package com.wangbin.alerting.core.lifecycle;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.ThresholdPatch;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.support.MutableClock;
import com.wangbin.alerting.support.TestEngine;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.wangbin.alerting.support.TestAlerts.alert;
import static org.junit.jupiter.api.Assertions.*;

class AlertLifecycleManagerTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private final TestEngine engine = TestEngine.create(clock, List.of());

    private Alert activate(Alert alert) {
        engine.store.withLock(() -> engine.store.add(alert));
        return alert;
    }

    @Test
    void unknownIdLeavesEverythingUntouched() {
        activate(alert(AlertType.PERFORMANCE, "response_time", AlertSeverity.HIGH, clock.instant()));

        assertFalse(engine.lifecycle.acknowledge("missing"));
        assertFalse(engine.lifecycle.resolve("missing"));
        assertEquals(1, engine.store.size());
        assertEquals(0, engine.repository.size());
    }

    @Test
    void acknowledgeKeepsAlertActive() {
        Alert alert = activate(alert(AlertType.PERFORMANCE, "response_time", AlertSeverity.HIGH, clock.instant()));

        assertTrue(engine.lifecycle.acknowledge(alert.getId()));

        Alert stored = engine.store.get(alert.getId()).orElseThrow();
        assertTrue(stored.isAcknowledged());
        assertFalse(stored.isResolved());
        assertEquals("2024-05-01T10:00:00Z", stored.getMetadataValue("acknowledged_at"));
        assertTrue(engine.repository.findById(alert.getId()).orElseThrow().isAcknowledged());
    }

    @Test
    void resolveRemovesFromActiveAndPersists() {
        Alert alert = activate(alert(AlertType.BUSINESS, "revenue", AlertSeverity.MEDIUM, clock.instant()));

        assertTrue(engine.lifecycle.resolve(alert.getId()));

        assertTrue(engine.store.get(alert.getId()).isEmpty());
        Alert persisted = engine.repository.findById(alert.getId()).orElseThrow();
        assertTrue(persisted.isResolved());
        assertEquals("manual", persisted.getMetadataValue(AlertLifecycleManager.RESOLVED_BY));
        assertFalse(engine.lifecycle.resolve(alert.getId()));
    }

    @Test
    void cleanupAutoResolvesAfterThresholdTimeout() {
        // response_time 默认 15 分钟自动恢复
        Alert alert = activate(alert(AlertType.PERFORMANCE, "response_time", AlertSeverity.HIGH, clock.instant()));

        clock.advance(Duration.ofMinutes(14));
        assertEquals(0, engine.lifecycle.cleanup());

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, engine.lifecycle.cleanup());
        assertEquals(0, engine.store.size());
        Alert persisted = engine.repository.findById(alert.getId()).orElseThrow();
        assertTrue(persisted.isResolved());
        assertEquals("auto", persisted.getMetadataValue(AlertLifecycleManager.RESOLVED_BY));
    }

    @Test
    void cleanupSkipsAlertsThatDoNotAutoResolve() {
        Alert alert = alert(AlertType.BUSINESS, "revenue", AlertSeverity.MEDIUM, clock.instant());
        alert.setAutoResolve(false);
        activate(alert);
        activate(alert(AlertType.ANOMALY, "unknown_metric", AlertSeverity.LOW, clock.instant()));

        clock.advance(Duration.ofDays(2));

        assertEquals(0, engine.lifecycle.cleanup());
        assertEquals(2, engine.store.size());
    }

    @Test
    void updateThresholdChangesAutoResolveTimeout() {
        activate(alert(AlertType.PERFORMANCE, "response_time", AlertSeverity.HIGH, clock.instant()));
        ThresholdPatch patch = new ThresholdPatch();
        patch.setAutoResolveTimeout(5);

        assertTrue(engine.lifecycle.updateThreshold("response_time", patch));
        assertFalse(engine.lifecycle.updateThreshold("no_such_metric", patch));

        clock.advance(Duration.ofMinutes(5));
        assertEquals(1, engine.lifecycle.cleanup());
    }

    @Test
    void escalationSkipsAcknowledgedAlerts() {
        Alert acknowledged = activate(alert(AlertType.PERFORMANCE, "response_time", AlertSeverity.HIGH, clock.instant()));
        activate(alert(AlertType.PERFORMANCE, "error_rate", AlertSeverity.HIGH, clock.instant()));
        engine.lifecycle.acknowledge(acknowledged.getId());

        clock.advance(Duration.ofMinutes(15));

        assertEquals(1, engine.lifecycle.handleEscalations());
        assertEquals(0, engine.lifecycle.handleEscalations());
    }

    @Test
    void resolveDuringEscalationDispatchStaysResolved() {
        Alert alert = activate(alert(AlertType.PERFORMANCE, "error_rate", AlertSeverity.HIGH, clock.instant()));
        engine.transport(ChannelType.SLACK).onSend(summary -> engine.lifecycle.resolve(summary.getAlertId()));
        clock.advance(Duration.ofMinutes(16));

        assertEquals(1, engine.lifecycle.handleEscalations());

        assertTrue(engine.store.get(alert.getId()).isEmpty());
        Alert persisted = engine.repository.findById(alert.getId()).orElseThrow();
        assertTrue(persisted.isResolved());
        assertEquals("manual", persisted.getMetadataValue(AlertLifecycleManager.RESOLVED_BY));
        assertTrue(engine.repository.loadUnresolved().isEmpty());
    }
}
