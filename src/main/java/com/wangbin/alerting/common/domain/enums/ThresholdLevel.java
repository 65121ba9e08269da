package com.wangbin.alerting.common.domain.enums;

/**
 * 阈值越界等级
 */
public enum ThresholdLevel {
    WARNING,
    CRITICAL
}
