package com.wangbin.alerting.core.notification;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.support.MutableClock;
import com.wangbin.alerting.support.TestEngine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.wangbin.alerting.support.TestAlerts.alert;
import static org.junit.jupiter.api.Assertions.*;

class NotificationDispatcherTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private final TestEngine engine = TestEngine.create(clock, List.of());

    @Test
    void criticalAlertReachesEveryConfiguredChannelExceptWebhook() {
        Alert alert = alert(AlertType.PERFORMANCE, "response_time", AlertSeverity.CRITICAL, clock.instant());

        List<DeliveryResult> results = engine.dispatcher.dispatch(alert);

        assertEquals(List.of(ChannelType.DASHBOARD, ChannelType.EMAIL, ChannelType.SLACK, ChannelType.TELEGRAM),
                results.stream().map(DeliveryResult::getChannel).toList());
        assertTrue(results.stream().allMatch(DeliveryResult::isSuccess));
        assertTrue(engine.transport(ChannelType.WEBHOOK).getSent().isEmpty());
    }

    @Test
    void failingChannelIsReportedWithoutAffectingOthers() {
        engine.transport(ChannelType.EMAIL).setFailing(true);
        Alert alert = alert(AlertType.ANOMALY, "revenue", AlertSeverity.HIGH, clock.instant());

        List<DeliveryResult> results = engine.dispatcher.dispatch(alert);

        DeliveryResult email = results.stream()
                .filter(r -> r.getChannel() == ChannelType.EMAIL)
                .findFirst()
                .orElseThrow();
        assertFalse(email.isSuccess());
        assertEquals("email unavailable", email.getErrorMessage());
        assertEquals(1, engine.transport(ChannelType.SLACK).getSent().size());
        assertEquals(1, engine.dashboardStore.recent(10).size());
    }

    @Test
    void severityFilterAndDisabledChannelsAreSkipped() {
        Alert low = alert(AlertType.BUSINESS, "revenue", AlertSeverity.LOW, clock.instant());
        low.setNotificationChannels(new ArrayList<>(List.of(ChannelType.DASHBOARD, ChannelType.EMAIL)));

        List<DeliveryResult> lowResults = engine.dispatcher.dispatch(low);
        assertEquals(List.of(ChannelType.DASHBOARD), lowResults.stream().map(DeliveryResult::getChannel).toList());
        assertTrue(engine.transport(ChannelType.EMAIL).getSent().isEmpty());

        engine.channels.reconfigure(ChannelType.SLACK, false, null);
        engine.dispatcher.dispatch(alert(AlertType.PERFORMANCE, "error_rate", AlertSeverity.HIGH, clock.instant()));
        assertTrue(engine.transport(ChannelType.SLACK).getSent().isEmpty());
        assertEquals(1, engine.transport(ChannelType.EMAIL).getSent().size());
    }

    @Test
    void repeatedChannelIsDeliveredOnce() {
        Alert alert = alert(AlertType.SECURITY, "login_failures", AlertSeverity.HIGH, clock.instant());
        alert.setNotificationChannels(new ArrayList<>(List.of(ChannelType.SLACK, ChannelType.SLACK)));

        engine.dispatcher.dispatch(alert);

        assertEquals(1, engine.transport(ChannelType.SLACK).getSent().size());
    }

    @Test
    void statisticsAreKeptPerTransport() {
        engine.transport(ChannelType.TELEGRAM).setFailing(true);
        engine.dispatcher.dispatch(alert(AlertType.PERFORMANCE, "response_time", AlertSeverity.CRITICAL, clock.instant()));

        var stats = engine.dispatcher.getTransportStatistics();
        assertEquals(1L, stats.get("telegram").get("failureSendCount"));
        assertEquals(1L, stats.get("slack").get("successSendCount"));
        assertEquals(0L, stats.get("webhook").get("totalSendCount"));
    }
}
