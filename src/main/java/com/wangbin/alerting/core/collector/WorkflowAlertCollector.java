package com.wangbin.alerting.core.collector;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import com.wangbin.alerting.common.domain.enums.AlertType;
import com.wangbin.alerting.common.domain.enums.MetricCategory;
import com.wangbin.alerting.core.source.MetricRow;
import com.wangbin.alerting.core.source.MetricSource;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 工作流失败率采集器
 */
public class WorkflowAlertCollector extends AbstractAlertCollector {

    public static final String METRIC = "workflow_failure_rate";

    private static final Duration WINDOW = Duration.ofHours(1);
    private static final double ALERT_RATE = 10;
    private static final double CRITICAL_RATE = 30;

    public WorkflowAlertCollector(MetricSource metricSource, Clock clock) {
        super("workflow_monitor", "workflow", AlertType.WORKFLOW, metricSource, clock);
    }

    @Override
    protected List<Alert> doCollect() {
        List<MetricRow> executions = metricSource.query(MetricCategory.WORKFLOW_EXECUTION, WINDOW);
        if (executions.isEmpty()) {
            return List.of();
        }

        long failed = executions.stream()
                .filter(row -> "failed".equalsIgnoreCase(row.getString("status")))
                .count();
        double failureRate = failed * 100.0 / executions.size();
        if (failureRate <= ALERT_RATE) {
            return List.of();
        }

        AlertSeverity severity = failureRate > CRITICAL_RATE ? AlertSeverity.CRITICAL : AlertSeverity.HIGH;
        Alert alert = newAlert(METRIC, severity)
                .title("High workflow failure rate")
                .message(String.format(Locale.ROOT, "%.1f%% of workflows failed in the last hour", failureRate))
                .currentValue(failureRate)
                .threshold(ALERT_RATE)
                .confidence(0.95)
                .autoResolve(false)
                .suggestedActions(new ArrayList<>(List.of(
                        "Check workflow configurations",
                        "Review error logs",
                        "Verify external integrations",
                        "Check system resources")))
                .build();
        alert.addMetadata("failed_workflows", failed);
        alert.addMetadata("total_workflows", executions.size());
        alert.addMetadata("time_window", "1_hour");
        return List.of(alert);
    }
}
