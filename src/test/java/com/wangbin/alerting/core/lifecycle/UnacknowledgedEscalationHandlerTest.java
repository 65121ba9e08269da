package com.wangbin.alerting.core.lifecycle;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.core.config.AlertingProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.wangbin.alerting.support.TestAlerts.alert;
import static org.junit.jupiter.api.Assertions.*;

class UnacknowledgedEscalationHandlerTest {

    private final Instant now = Instant.parse("2024-05-01T10:30:00Z");
    private final AlertingProperties properties = new AlertingProperties();
    private final UnacknowledgedEscalationHandler handler = new UnacknowledgedEscalationHandler(properties);

    @Test
    void selectsOnlyStaleUnacknowledgedAlerts() {
        Alert stale = alert(AlertType.PERFORMANCE, "response_time", AlertSeverity.HIGH, now.minusSeconds(15 * 60));
        Alert fresh = alert(AlertType.PERFORMANCE, "error_rate", AlertSeverity.HIGH, now.minusSeconds(14 * 60));
        Alert acknowledged = alert(AlertType.BUSINESS, "revenue", AlertSeverity.MEDIUM, now.minusSeconds(3600));
        acknowledged.setAcknowledged(true);
        Alert escalated = alert(AlertType.ANOMALY, "clicks", AlertSeverity.CRITICAL, now.minusSeconds(3600));
        escalated.addMetadata(UnacknowledgedEscalationHandler.ESCALATED, true);

        List<Alert> selected = handler.select(List.of(stale, fresh, acknowledged, escalated), now);

        assertEquals(List.of(stale), selected);
    }

    @Test
    void timeoutIsReadFromCurrentSettings() {
        Alert alert = alert(AlertType.PERFORMANCE, "response_time", AlertSeverity.HIGH, now.minusSeconds(5 * 60));
        assertTrue(handler.select(List.of(alert), now).isEmpty());

        properties.getNotificationSettings().setEscalationTimeoutMinutes(5);
        assertEquals(1, handler.select(List.of(alert), now).size());
    }
}
