package com.wangbin.alerting.api.controller;

import com.wangbin.alerting.api.dto.ChannelUpdateRequest;
import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.AlertThreshold;
import com.wangbin.alerting.common.domain.entity.NotificationChannel;
import com.wangbin.alerting.common.domain.entity.ThresholdPatch;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.common.web.result.ApiResult;
import com.wangbin.alerting.common.web.result.ResultCode;
import com.wangbin.alerting.core.notification.DashboardNotification;
import com.wangbin.alerting.core.pipeline.TickReport;
import com.wangbin.alerting.core.service.AlertStatistics;
import com.wangbin.alerting.core.service.IntelligentAlertService;
import com.wangbin.alerting.monitor.health.AlertEngineHealthService;
import com.wangbin.alerting.monitor.health.EngineHealth;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 告警引擎接口
 */
@Validated
@RestController
@RequestMapping("/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final IntelligentAlertService alertService;
    private final AlertEngineHealthService healthService;

    @GetMapping("/active")
    public ApiResult<List<Alert>> activeAlerts() {
        return ApiResult.success(alertService.getActiveAlerts());
    }

    @GetMapping("/active/{id}")
    public ApiResult<Alert> activeAlert(@PathVariable String id) {
        return ApiResult.found(alertService.getActiveAlert(id), notFound(id));
    }

    @PostMapping("/{id}/acknowledge")
    public ApiResult<Void> acknowledge(@PathVariable String id) {
        return ApiResult.outcome(alertService.acknowledge(id), ResultCode.DATA_NOT_FOUND, notFound(id));
    }

    @PostMapping("/{id}/resolve")
    public ApiResult<Void> resolve(@PathVariable String id) {
        return ApiResult.outcome(alertService.resolve(id), ResultCode.DATA_NOT_FOUND, notFound(id));
    }

    @GetMapping("/thresholds")
    public ApiResult<List<AlertThreshold>> thresholds() {
        return ApiResult.success(alertService.getThresholds());
    }

    @PutMapping("/thresholds/{metric}")
    public ApiResult<Void> updateThreshold(@PathVariable String metric, @Valid @RequestBody ThresholdPatch patch) {
        return ApiResult.outcome(alertService.updateThreshold(metric, patch),
                ResultCode.DATA_INVALID, "指标不存在或阈值不合法: " + metric);
    }

    @GetMapping("/statistics")
    public ApiResult<AlertStatistics> statistics() {
        return ApiResult.success(alertService.getStatistics());
    }

    @GetMapping("/channels")
    public ApiResult<List<NotificationChannel>> channels() {
        return ApiResult.success(alertService.getChannels());
    }

    @PutMapping("/channels/{type}")
    public ApiResult<Void> reconfigureChannel(@PathVariable String type, @RequestBody ChannelUpdateRequest request) {
        ChannelType channelType = ChannelType.fromCode(type);
        return ApiResult.outcome(
                alertService.reconfigureChannel(channelType, request.getEnabled(), request.getSeverityFilter()),
                ResultCode.OPERATION_FAILED, "渠道重新配置失败: " + type);
    }

    @GetMapping("/notifications/dashboard")
    public ApiResult<List<DashboardNotification>> dashboardNotifications(
            @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int limit) {
        return ApiResult.success(alertService.getDashboardNotifications(limit));
    }

    @PostMapping("/engine/start")
    public ApiResult<Map<String, Object>> start() {
        alertService.start();
        return ApiResult.success(alertService.getEngineStatus());
    }

    @PostMapping("/engine/stop")
    public ApiResult<Map<String, Object>> stop() {
        alertService.stop();
        return ApiResult.success(alertService.getEngineStatus());
    }

    @PostMapping("/engine/run")
    public ApiResult<TickReport> runNow() {
        return alertService.runNow()
                .map(ApiResult::success)
                .orElseGet(() -> ApiResult.error(ResultCode.OPERATION_FAILED, "上一轮流水线仍在执行"));
    }

    @GetMapping("/health")
    public ApiResult<EngineHealth> health() {
        return ApiResult.success(healthService.getHealth());
    }

    private static String notFound(String id) {
        return "告警不存在或已恢复: " + id;
    }
}
