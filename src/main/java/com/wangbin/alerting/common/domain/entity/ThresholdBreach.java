package com.wangbin.alerting.common.domain.entity;

import com.wangbin.alerting.common.domain.enums.ThresholdLevel;

/**
 * 阈值越界结果
 *
 * @param level 越界等级
 * @param limit 被越过的边界值
 */
public record ThresholdBreach(ThresholdLevel level, double limit) {

    public boolean isCritical() {
        return level == ThresholdLevel.CRITICAL;
    }
}
