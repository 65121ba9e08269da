package com.wangbin.alerting.monitor.health;

import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.core.collector.AlertCollector;
import com.wangbin.alerting.core.collector.CollectorStatus;
import com.wangbin.alerting.core.config.AlertingProperties;
import com.wangbin.alerting.core.persistence.AlertPersister;
import com.wangbin.alerting.core.pipeline.AlertPipeline;
import com.wangbin.alerting.core.pipeline.TickReport;
import com.wangbin.alerting.core.registry.NotificationChannelRegistry;
import com.wangbin.alerting.core.scheduler.AlertScheduler;
import com.wangbin.alerting.monitor.health.EngineHealth.Status;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 聚合告警引擎健康信息
 */
@Service
@RequiredArgsConstructor
public class AlertEngineHealthService {

    private final AlertScheduler scheduler;
    private final AlertPipeline pipeline;
    private final NotificationChannelRegistry channelRegistry;
    private final AlertPersister persister;
    private final AlertingProperties properties;
    private final Clock clock;

    public EngineHealth getHealth() {
        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        components.put("scheduler", buildSchedulerHealth());
        for (AlertCollector collector : pipeline.getCollectors()) {
            components.put("collector." + collector.getName(), buildCollectorHealth(collector.getStatus()));
        }
        components.put("channels", buildChannelHealth());
        components.put("persistence", buildPersistenceHealth());

        return EngineHealth.builder()
                .status(EngineHealth.aggregate(components.values()))
                .checkedAt(clock.instant())
                .components(components)
                .build();
    }

    private ComponentHealth buildSchedulerHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("enabled", properties.isEnabled());
        details.put("running", scheduler.isRunning());
        details.put("updateInterval", properties.getUpdateInterval().toString());
        details.put("tickCount", scheduler.getTickCount());
        details.put("failedTickCount", scheduler.getFailedTickCount());
        details.put("skippedTickCount", scheduler.getSkippedTickCount());
        TickReport last = scheduler.getLastTickReport();
        if (last != null) {
            details.put("lastTickAt", last.getFinishedAt());
            details.put("lastTickDurationMs", last.getDurationMs());
            details.put("lastTickAccepted", last.getAccepted());
        }

        Status status = scheduler.isRunning() ? Status.UP : Status.STOPPED;
        return ComponentHealth.builder()
                .name("scheduler")
                .status(status)
                .message(scheduler.isRunning() ? "Alert scheduler is running" : "Alert scheduler is stopped")
                .details(details)
                .build();
    }

    private ComponentHealth buildCollectorHealth(CollectorStatus status) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalRuns", status.getTotalRuns());
        details.put("failedRuns", status.getFailedRuns());
        details.put("totalCandidates", status.getTotalCandidates());
        details.put("lastRunAt", status.getLastRunAt());
        details.put("lastDurationMs", status.getLastDurationMs());
        if (status.getLastError() != null) {
            details.put("lastError", status.getLastError());
        }
        return ComponentHealth.builder()
                .name(status.getName())
                .status(status.isLastSucceeded() ? Status.UP : Status.DEGRADED)
                .message(status.isLastSucceeded() ? "Last run succeeded" : "Last run failed")
                .details(details)
                .build();
    }

    private ComponentHealth buildChannelHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        for (NotificationChannel channel : channelRegistry.getAll()) {
            details.put(channel.getType().getCode(), channel.isEnabled());
        }
        return ComponentHealth.builder()
                .name("channels")
                .status(Status.UP)
                .message("Notification channel registry")
                .details(details)
                .build();
    }

    private ComponentHealth buildPersistenceHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("repository", persister.getRepositoryName());
        details.put("successCount", persister.getSuccessCount());
        details.put("failureCount", persister.getFailureCount());
        Status status = persister.getFailureCount() > 0 && persister.getSuccessCount() == 0
                ? Status.DEGRADED : Status.UP;
        return ComponentHealth.builder()
                .name("persistence")
                .status(status)
                .message("Best-effort alert persistence")
                .details(details)
                .build();
    }
}
