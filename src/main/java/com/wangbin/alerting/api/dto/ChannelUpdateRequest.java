package com.wangbin.alerting.api.dto;

import com.wangbin.alerting.common.domain.enums.AlertSeverity;
import lombok.Data;

import java.util.Set;

/**
 * 渠道重新配置请求，null 字段表示保持原值
 */
@Data
public class ChannelUpdateRequest {
    private Boolean enabled;
    private Set<AlertSeverity> severityFilter;
}
