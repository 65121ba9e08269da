package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 告警类型枚举
 */
public enum AlertType {

    PERFORMANCE("performance", "性能告警"),
    BUSINESS("business", "业务指标告警"),
    SECURITY("security", "安全告警"),
    ANOMALY("anomaly", "统计异常告警"),
    FORECAST("forecast", "预测告警"),
    WORKFLOW("workflow", "工作流告警");

    private final String code;
    private final String description;

    AlertType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    @JsonCreator
    public static AlertType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AlertType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的告警类型: " + code);
    }
}
