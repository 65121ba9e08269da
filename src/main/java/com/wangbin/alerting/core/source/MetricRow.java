package com.wangbin.alerting.core.source;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 数据源返回的一行指标数据，数值字段按名称访问
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricRow {

    private Instant timestamp;

    private Map<String, Object> fields = new LinkedHashMap<>();

    public static MetricRow of(Instant timestamp, Map<String, ?> fields) {
        return new MetricRow(timestamp, new LinkedHashMap<>(fields));
    }

    /**
     * 读取数值字段，缺失或无法解析时返回 null
     */
    public Double getDouble(String name) {
        Object value = fields != null ? fields.get(name) : null;
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public double getDouble(String name, double defaultValue) {
        Double value = getDouble(name);
        return value != null ? value : defaultValue;
    }

    public String getString(String name) {
        Object value = fields != null ? fields.get(name) : null;
        return value != null ? value.toString() : null;
    }
}
