package com.wangbin.alerting.core.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 告警引擎配置
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "alerting")
public class AlertingProperties {

    private static final Duration DEFAULT_UPDATE_INTERVAL = Duration.ofSeconds(30);
    private static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofHours(1);
    private static final int DEFAULT_MAX_ALERTS_PER_HOUR = 100;

    /**
     * 是否启用告警引擎
     */
    private boolean enabled = true;

    /**
     * 应用启动后是否自动开始调度
     */
    private boolean autoStart = true;

    /**
     * 告警流水线执行间隔
     */
    private Duration updateInterval = DEFAULT_UPDATE_INTERVAL;

    /**
     * 已恢复告警清理间隔
     */
    private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;

    /**
     * 每个 (类型, 指标) 每小时最多接受的告警数
     */
    private int maxAlertsPerHour = DEFAULT_MAX_ALERTS_PER_HOUR;

    /**
     * 是否丢弃重复告警
     */
    private boolean autoAcknowledgeDuplicates = true;

    /**
     * 内存中保留的告警历史条数
     */
    private int historySize = 1000;

    /**
     * 单个采集器单次执行的超时时间
     */
    private Duration collectorTimeout = Duration.ofSeconds(10);

    private AnomalyDetection anomalyDetection = new AnomalyDetection();

    private NotificationSettings notificationSettings = new NotificationSettings();

    private MlEnhancement mlEnhancement = new MlEnhancement();

    /**
     * 阈值覆盖配置，未配置的指标使用内置默认值
     */
    private List<ThresholdConfig> thresholds = new ArrayList<>();

    private Channels channels = new Channels();

    private MetricSourceConfig metricSource = new MetricSourceConfig();

    private PersistenceConfig persistence = new PersistenceConfig();

    /**
     * 非法配置回退到默认值，不阻断启动
     */
    @PostConstruct
    public void validate() {
        if (updateInterval == null || updateInterval.isZero() || updateInterval.isNegative()) {
            log.warn("alerting.update-interval 配置无效: {}，使用默认值 {}", updateInterval, DEFAULT_UPDATE_INTERVAL);
            updateInterval = DEFAULT_UPDATE_INTERVAL;
        }
        if (cleanupInterval == null || cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            log.warn("alerting.cleanup-interval 配置无效: {}，使用默认值 {}", cleanupInterval, DEFAULT_CLEANUP_INTERVAL);
            cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
        }
        if (maxAlertsPerHour <= 0) {
            log.warn("alerting.max-alerts-per-hour 配置无效: {}，使用默认值 {}", maxAlertsPerHour, DEFAULT_MAX_ALERTS_PER_HOUR);
            maxAlertsPerHour = DEFAULT_MAX_ALERTS_PER_HOUR;
        }
        if (historySize <= 0) {
            historySize = 1000;
        }
        if (collectorTimeout == null || collectorTimeout.isZero() || collectorTimeout.isNegative()) {
            collectorTimeout = Duration.ofSeconds(10);
        }
        if (persistence.getTimeout() == null || persistence.getTimeout().isZero() || persistence.getTimeout().isNegative()) {
            persistence.setTimeout(Duration.ofSeconds(5));
        }
        anomalyDetection.validate();
        notificationSettings.validate();
    }

    // =============== 配置类定义 ===============

    @Data
    public static class AnomalyDetection {
        private boolean enabled = true;

        /**
         * 灵敏度 1-10，检测阈值 = sensitivity / 2
         */
        private double sensitivity = 7;

        private int minDataPoints = 10;

        private double confidenceThreshold = 0.8;

        /**
         * 实时指标回看窗口
         */
        private Duration lookback = Duration.ofHours(24);

        private List<String> metrics = new ArrayList<>(List.of("revenue", "impressions", "clicks", "conversions"));

        public double detectionThreshold() {
            return sensitivity / 2.0;
        }

        void validate() {
            if (sensitivity < 1 || sensitivity > 10) {
                log.warn("alerting.anomaly-detection.sensitivity 超出范围 1-10: {}，使用默认值 7", sensitivity);
                sensitivity = 7;
            }
            if (minDataPoints < 2) {
                log.warn("alerting.anomaly-detection.min-data-points 至少为2: {}，使用默认值 10", minDataPoints);
                minDataPoints = 10;
            }
            if (confidenceThreshold < 0 || confidenceThreshold > 1) {
                confidenceThreshold = 0.8;
            }
            if (lookback == null || lookback.isNegative() || lookback.isZero()) {
                lookback = Duration.ofHours(24);
            }
        }
    }

    @Data
    public static class NotificationSettings {
        private boolean rateLimiting = true;

        /**
         * 保留的批量通知开关，当前逐条投递
         */
        private boolean batchNotifications = true;

        private boolean escalationEnabled = true;

        private int escalationTimeoutMinutes = 15;

        /**
         * 单渠道单次发送超时
         */
        private Duration sendTimeout = Duration.ofSeconds(10);

        void validate() {
            if (escalationTimeoutMinutes <= 0) {
                log.warn("alerting.notification-settings.escalation-timeout-minutes 配置无效: {}，使用默认值 15",
                        escalationTimeoutMinutes);
                escalationTimeoutMinutes = 15;
            }
            if (sendTimeout == null || sendTimeout.isNegative() || sendTimeout.isZero()) {
                sendTimeout = Duration.ofSeconds(10);
            }
        }
    }

    @Data
    public static class MlEnhancement {
        private boolean enabled = true;
        private boolean patternLearning = true;
    }

    @Data
    public static class ThresholdConfig {
        private String metric;
        private Double warningMin;
        private Double warningMax;
        private Double criticalMin;
        private Double criticalMax;
        private boolean enabled = true;
        private Integer autoResolveTimeout;
    }

    @Data
    public static class Channels {
        private EmailChannel email = new EmailChannel();
        private SlackChannel slack = new SlackChannel();
        private TelegramChannel telegram = new TelegramChannel();
        private WebhookChannel webhook = new WebhookChannel();
    }

    @Data
    public static class EmailChannel {
        private boolean enabled = false;
        private List<String> recipients = new ArrayList<>();
        private String from = "alerts@localhost";
    }

    @Data
    public static class SlackChannel {
        private String webhookUrl;
    }

    @Data
    public static class TelegramChannel {
        private String botToken;
        private String chatId;
        private String apiBaseUrl = "https://api.telegram.org";
    }

    @Data
    public static class WebhookChannel {
        private String url;
    }

    @Data
    public static class MetricSourceConfig {
        /**
         * memory | http
         */
        private String type = "memory";
        private String baseUrl;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);

        /**
         * 性能指标单次最多取样条数
         */
        private int performanceSampleLimit = 100;

        /**
         * 内存数据源保留时长
         */
        private Duration retention = Duration.ofHours(48);
    }

    @Data
    public static class PersistenceConfig {
        /**
         * memory | redis
         */
        private String type = "memory";
        private String key = "alerting:alerts";
        private Duration timeout = Duration.ofSeconds(5);
    }
}
