package com.wangbin.alerting.core.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 单轮流水线执行结果
 */
@Value
@Builder
public class TickReport {
    int candidates;
    int accepted;
    int duplicates;
    int rateLimited;
    int persistFailures;
    List<String> failedCollectors;
    List<String> acceptedIds;
    long durationMs;
    Instant finishedAt;
}
