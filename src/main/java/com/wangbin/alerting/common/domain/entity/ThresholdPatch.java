package com.wangbin.alerting.common.domain.entity;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 阈值局部更新，null 字段表示保持原值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdPatch {
    private Double warningMin;
    private Double warningMax;
    private Double criticalMin;
    private Double criticalMax;
    private Boolean enabled;
    @Positive
    private Integer autoResolveTimeout;
}
