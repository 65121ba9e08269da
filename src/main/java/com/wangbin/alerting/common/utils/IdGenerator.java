package com.wangbin.alerting.common.utils;

import java.util.concurrent.atomic.AtomicLong;

/**
 * ID生成器工具类
 */
public class IdGenerator {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private IdGenerator() {
        // 工具类，防止实例化
    }

    /**
     * 生成告警ID：来源前缀_指标_创建毫秒_进程内序号
     * 同一毫秒内多次生成也不会重复
     */
    public static String generateAlertId(String prefix, String metric, long epochMillis) {
        String safeMetric = metric == null || metric.isBlank() ? "general" : metric;
        return prefix + "_" + safeMetric + "_" + epochMillis + "_" + SEQUENCE.incrementAndGet();
    }
}
