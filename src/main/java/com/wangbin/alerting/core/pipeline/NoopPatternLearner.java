package com.wangbin.alerting.core.pipeline;

import com.wangbin.alerting.common.domain.entity.Alert;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class NoopPatternLearner implements AlertPatternLearner {

    @Override
    public void learn(List<Alert> recentHistory) {
        log.debug("模式学习未启用实现，跳过 {} 条历史告警", recentHistory.size());
    }
}
