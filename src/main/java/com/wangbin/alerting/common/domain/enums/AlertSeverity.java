package com.wangbin.alerting.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 告警级别枚举，级别越高通知范围越广
 */
public enum AlertSeverity {

    LOW(1, "low", "低"),
    MEDIUM(2, "medium", "中"),
    HIGH(3, "high", "高"),
    CRITICAL(4, "critical", "严重");

    private final int level;
    private final String code;
    private final String description;

    AlertSeverity(int level, String code, String description) {
        this.level = level;
        this.code = code;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    // 根据code获取枚举，大小写不敏感
    @JsonCreator
    public static AlertSeverity fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AlertSeverity severity : values()) {
            if (severity.code.equalsIgnoreCase(code.trim())) {
                return severity;
            }
        }
        throw new IllegalArgumentException("未知的告警级别: " + code);
    }
}
