package com.wangbin.alerting.core.config;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.exception.AlertingException;
import com.wangbin.alerting.core.collector.AlertCollector;
import com.wangbin.alerting.core.collector.BusinessMetricCollector;
import com.wangbin.alerting.core.collector.PerformanceAlertCollector;
import com.wangbin.alerting.core.collector.RealtimeAnomalyCollector;
import com.wangbin.alerting.core.collector.WorkflowAlertCollector;
import com.wangbin.alerting.core.detector.AnomalyDetector;
import com.wangbin.alerting.core.lifecycle.EscalationHandler;
import com.wangbin.alerting.core.lifecycle.NoopEscalationHandler;
import com.wangbin.alerting.core.lifecycle.UnacknowledgedEscalationHandler;
import com.wangbin.alerting.core.persistence.AlertRepository;
import com.wangbin.alerting.core.persistence.InMemoryAlertRepository;
import com.wangbin.alerting.core.persistence.RedisAlertRepository;
import com.wangbin.alerting.core.pipeline.AlertPatternLearner;
import com.wangbin.alerting.core.pipeline.NoopPatternLearner;
import com.wangbin.alerting.core.registry.ThresholdRegistry;
import com.wangbin.alerting.core.source.HttpMetricSource;
import com.wangbin.alerting.core.source.InMemoryMetricSource;
import com.wangbin.alerting.core.source.MetricSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * 告警引擎组件装配
 *
 * 数据源与仓储按配置类型选择实现，扩展点默认使用空实现。
 */
@Slf4j
@Configuration
public class AlertEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("notificationRestTemplate")
    public RestTemplate notificationRestTemplate(RestTemplateBuilder builder, AlertingProperties properties) {
        Duration sendTimeout = properties.getNotificationSettings().getSendTimeout();
        return builder
                .setConnectTimeout(sendTimeout)
                .setReadTimeout(sendTimeout)
                .build();
    }

    @Bean
    public MetricSource metricSource(RestTemplateBuilder builder, AlertingProperties properties, Clock clock) {
        AlertingProperties.MetricSourceConfig config = properties.getMetricSource();
        if ("http".equalsIgnoreCase(config.getType())) {
            if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
                throw AlertingException.configInvalid("metric-source", "metric-source.type=http 时必须配置 base-url");
            }
            RestTemplate restTemplate = builder
                    .setConnectTimeout(config.getConnectTimeout())
                    .setReadTimeout(config.getReadTimeout())
                    .build();
            log.info("使用 HTTP 指标数据源: {}", config.getBaseUrl());
            return new HttpMetricSource(restTemplate, config.getBaseUrl(), clock);
        }
        if (!"memory".equalsIgnoreCase(config.getType())) {
            log.warn("未知的指标数据源类型 {}，回退到内存数据源", config.getType());
        }
        return new InMemoryMetricSource(clock, config.getRetention());
    }

    @Bean
    public AlertRepository alertRepository(AlertingProperties properties,
                                           ObjectProvider<RedisTemplate<String, Alert>> alertRedisTemplate) {
        AlertingProperties.PersistenceConfig config = properties.getPersistence();
        if ("redis".equalsIgnoreCase(config.getType())) {
            RedisTemplate<String, Alert> template = alertRedisTemplate.getIfAvailable();
            if (template != null) {
                log.info("使用 Redis 告警仓储，key={}", config.getKey());
                return new RedisAlertRepository(template, config.getKey());
            }
            log.warn("未找到告警 RedisTemplate，回退到内存仓储");
        }
        return new InMemoryAlertRepository();
    }

    @Bean
    public AlertCollector realtimeAnomalyCollector(MetricSource metricSource, AnomalyDetector anomalyDetector,
                                                   AlertingProperties properties, Clock clock) {
        return new RealtimeAnomalyCollector(metricSource, anomalyDetector, properties, clock);
    }

    @Bean
    public AlertCollector performanceAlertCollector(MetricSource metricSource, ThresholdRegistry thresholdRegistry,
                                                    AlertingProperties properties, Clock clock) {
        return new PerformanceAlertCollector(metricSource, thresholdRegistry, properties, clock);
    }

    @Bean
    public AlertCollector businessMetricCollector(MetricSource metricSource, ThresholdRegistry thresholdRegistry,
                                                  Clock clock) {
        return new BusinessMetricCollector(metricSource, thresholdRegistry, clock);
    }

    @Bean
    public AlertCollector workflowAlertCollector(MetricSource metricSource, Clock clock) {
        return new WorkflowAlertCollector(metricSource, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EscalationHandler escalationHandler(AlertingProperties properties) {
        if (properties.getNotificationSettings().isEscalationEnabled()) {
            return new UnacknowledgedEscalationHandler(properties);
        }
        return new NoopEscalationHandler();
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertPatternLearner alertPatternLearner() {
        return new NoopPatternLearner();
    }
}
