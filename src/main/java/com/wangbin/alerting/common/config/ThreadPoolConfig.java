package com.wangbin.alerting.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    private final int cpuCores = Runtime.getRuntime().availableProcessors();

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 告警调度线程池（流水线与清理任务）
     */
    @Bean(name = "alertSchedulerExecutor", destroyMethod = "shutdown")
    public ScheduledExecutorService alertSchedulerExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                2,
                buildNamedThreadFactory("alert-scheduler", true)
        );
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 采集器线程池（IO密集型，每轮并发执行所有采集器）
     */
    @Bean(name = "collectorExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor collectorExecutor() {
        return new ThreadPoolExecutor(
                4,
                Math.max(8, cpuCores * 2),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(100),
                buildNamedThreadFactory("alert-collector", true),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * 通知发送线程池
     */
    @Bean(name = "notificationExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor notificationExecutor() {
        return new ThreadPoolExecutor(
                5,
                20,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(500),
                buildNamedThreadFactory("alert-notification", true),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * 持久化线程池
     */
    @Bean(name = "persistenceExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor persistenceExecutor() {
        return new ThreadPoolExecutor(
                2,
                4,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                buildNamedThreadFactory("alert-persistence", true),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }
}
