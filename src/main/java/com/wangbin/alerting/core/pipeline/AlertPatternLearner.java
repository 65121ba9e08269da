package com.wangbin.alerting.core.pipeline;

import com.wangbin.alerting.common.domain.entity.Alert;

import java.util.List;

/**
 * 告警模式学习扩展点，每轮流水线结束后以最近历史调用
 */
public interface AlertPatternLearner {

    void learn(List<Alert> recentHistory);
}
