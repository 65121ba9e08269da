package com.wangbin.alerting.core.service;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 告警统计：total/bySeverity/byType/acknowledged 统计活动集合，resolved 统计历史
 */
@Value
@Builder
public class AlertStatistics {
    int total;
    Map<String, Long> bySeverity;
    Map<String, Long> byType;
    long acknowledged;
    long resolved;
}
