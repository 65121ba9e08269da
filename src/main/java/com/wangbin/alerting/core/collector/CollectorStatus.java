package com.wangbin.alerting.core.collector;

import lombok.Builder;
import lombok.Value;

/**
 * 采集器运行状态快照
 */
@Value
@Builder
public class CollectorStatus {
    String name;
    long totalRuns;
    long failedRuns;
    long totalCandidates;
    Long lastRunAt;
    Long lastDurationMs;
    boolean lastSucceeded;
    String lastError;
}
