package com.wangbin.alerting.support;

import com.google.common.util.concurrent.MoreExecutors;
import com.wangbin.alerting.common.domain.enums.ChannelType;
import com.wangbin.alerting.core.collector.AlertCollector;
import com.wangbin.alerting.core.config.AlertingProperties;
import com.wangbin.alerting.core.lifecycle.AlertLifecycleManager;
import com.wangbin.alerting.core.lifecycle.EscalationHandler;
import com.wangbin.alerting.core.lifecycle.NoopEscalationHandler;
import com.wangbin.alerting.core.lifecycle.UnacknowledgedEscalationHandler;
import com.wangbin.alerting.core.notification.DashboardNotificationStore;
import com.wangbin.alerting.core.notification.NotificationDispatcher;
import com.wangbin.alerting.core.notification.transport.DashboardNotificationTransport;
import com.wangbin.alerting.core.notification.transport.NotificationTransport;
import com.wangbin.alerting.core.persistence.AlertPersister;
import com.wangbin.alerting.core.persistence.InMemoryAlertRepository;
import com.wangbin.alerting.core.pipeline.ActiveAlertStore;
import com.wangbin.alerting.core.pipeline.AlertDeduplicator;
import com.wangbin.alerting.core.pipeline.AlertPipeline;
import com.wangbin.alerting.core.pipeline.AlertRateLimiter;
import com.wangbin.alerting.core.pipeline.NoopPatternLearner;
import com.wangbin.alerting.core.registry.NotificationChannelRegistry;
import com.wangbin.alerting.core.registry.ThresholdRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * 手工装配的告警引擎，所有线程池替换为调用线程直接执行
 */
public class TestEngine {

    public final MutableClock clock;
    public final AlertingProperties properties;
    public final ThresholdRegistry thresholds;
    public final NotificationChannelRegistry channels;
    public final ActiveAlertStore store;
    public final InMemoryAlertRepository repository;
    public final AlertPersister persister;
    public final DashboardNotificationStore dashboardStore;
    public final Map<ChannelType, RecordingTransport> transports = new EnumMap<>(ChannelType.class);
    public final NotificationDispatcher dispatcher;
    public final AlertLifecycleManager lifecycle;
    public final AlertRateLimiter rateLimiter;
    public final AlertPipeline pipeline;

    private TestEngine(MutableClock clock, AlertingProperties properties, List<AlertCollector> collectors) {
        this.clock = clock;
        this.properties = properties;
        ExecutorService direct = MoreExecutors.newDirectExecutorService();

        thresholds = new ThresholdRegistry(properties);
        channels = new NotificationChannelRegistry(properties);
        store = new ActiveAlertStore(properties);
        repository = new InMemoryAlertRepository();
        persister = new AlertPersister(repository, direct, properties);
        dashboardStore = new DashboardNotificationStore(1000, 3600);

        List<NotificationTransport> all = new ArrayList<>();
        all.add(new DashboardNotificationTransport(dashboardStore, clock));
        for (ChannelType type : List.of(ChannelType.EMAIL, ChannelType.SLACK, ChannelType.TELEGRAM, ChannelType.WEBHOOK)) {
            RecordingTransport transport = new RecordingTransport(type);
            transports.put(type, transport);
            all.add(transport);
        }
        dispatcher = new NotificationDispatcher(channels, all, direct, properties);

        EscalationHandler escalationHandler = properties.getNotificationSettings().isEscalationEnabled()
                ? new UnacknowledgedEscalationHandler(properties)
                : new NoopEscalationHandler();
        lifecycle = new AlertLifecycleManager(store, persister, thresholds, dispatcher, escalationHandler, clock);
        rateLimiter = new AlertRateLimiter(properties, clock);
        pipeline = new AlertPipeline(collectors, store, new AlertDeduplicator(clock), rateLimiter,
                persister, dispatcher, lifecycle, new NoopPatternLearner(), direct, properties, clock);
    }

    public static TestEngine create(MutableClock clock, List<AlertCollector> collectors) {
        return create(clock, allChannelsEnabled(), collectors);
    }

    public static TestEngine create(MutableClock clock, AlertingProperties properties, List<AlertCollector> collectors) {
        properties.validate();
        return new TestEngine(clock, properties, collectors);
    }

    /**
     * 所有外部渠道都已配置的属性
     */
    public static AlertingProperties allChannelsEnabled() {
        AlertingProperties properties = new AlertingProperties();
        AlertingProperties.Channels channels = properties.getChannels();
        channels.getEmail().setEnabled(true);
        channels.getEmail().setRecipients(List.of("ops@example.com"));
        channels.getSlack().setWebhookUrl("https://hooks.slack.test/T000/B000");
        channels.getTelegram().setBotToken("token");
        channels.getTelegram().setChatId("42");
        channels.getWebhook().setUrl("https://webhook.test/alerts");
        return properties;
    }

    public RecordingTransport transport(ChannelType type) {
        return transports.get(type);
    }
}
