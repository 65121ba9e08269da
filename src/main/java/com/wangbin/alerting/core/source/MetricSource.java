package com.wangbin.alerting.core.source;

import com.wangbin.alerting.common.domain.enums.MetricCategory;
import com.wangbin.alerting.common.exception.AlertingException;

import java.time.Duration;
import java.util.List;

/**
 * 指标数据源
 */
public interface MetricSource {

    /**
     * 查询指定分类在最近时间窗口内的数据，按时间升序返回
     *
     * @param category 指标分类
     * @param window   回看窗口
     * @return 数据行，无数据时返回空列表
     * @throws AlertingException 数据源不可用时抛出（DATA_UNAVAILABLE）
     */
    List<MetricRow> query(MetricCategory category, Duration window);

    /**
     * 数据源名称，用于日志和健康检查
     */
    String getName();
}
