package com.wangbin.alerting.core.lifecycle;

import com.wangbin.alerting.common.domain.entity.Alert;

import java.time.Instant;
import java.util.List;

public class NoopEscalationHandler implements EscalationHandler {

    @Override
    public List<Alert> select(List<Alert> activeAlerts, Instant now) {
        return List.of();
    }
}
