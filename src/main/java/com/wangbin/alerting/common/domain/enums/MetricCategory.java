package com.wangbin.alerting.common.domain.enums;

/**
 * 指标数据源分类，code 对应数据源中的表/资源名
 */
public enum MetricCategory {

    MARKETING("marketing_data", "date", "营销实时数据"),
    SYSTEM("system_metrics", "timestamp", "系统/API指标"),
    DAILY_AGGREGATE("daily_aggregates", "date", "每日业务汇总"),
    WORKFLOW_EXECUTION("workflow_executions", "created_at", "工作流执行记录");

    private final String code;
    private final String timestampField;
    private final String description;

    MetricCategory(String code, String timestampField, String description) {
        this.code = code;
        this.timestampField = timestampField;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getTimestampField() {
        return timestampField;
    }

    public String getDescription() {
        return description;
    }
}
