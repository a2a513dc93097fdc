package com.wangbin.alerting.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
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
     * 告警处理线程池（批次内按告警并发，由信号量限流）
     */
    @Bean(name = "alertProcessingExecutor", destroyMethod = "shutdown")
    public ExecutorService alertProcessingExecutor() {
        return new ThreadPoolExecutor(
                cpuCores * 2,
                cpuCores * 8,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(5000),
                buildNamedThreadFactory("alert-processing", true),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * 目标发布线程池（IO密集型）
     */
    @Bean(name = "publishExecutor", destroyMethod = "shutdown")
    public ExecutorService publishExecutor() {
        return new ThreadPoolExecutor(
                cpuCores * 4,
                cpuCores * 16,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(10000),
                buildNamedThreadFactory("target-publish", true),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * 分类服务调用线程池，调用超时后被中断
     */
    @Bean(name = "classificationExecutor", destroyMethod = "shutdown")
    public ExecutorService classificationExecutor() {
        return new ThreadPoolExecutor(
                cpuCores * 2,
                cpuCores * 8,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(2000),
                buildNamedThreadFactory("classification-call", true),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * 告警存储线程池（fire-and-forget，满了丢弃最旧任务）
     */
    @Bean(name = "storageExecutor", destroyMethod = "shutdown")
    public ExecutorService storageExecutor() {
        return new ThreadPoolExecutor(
                2,
                4,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(2000),
                buildNamedThreadFactory("alert-storage", true),
                new ThreadPoolExecutor.DiscardOldestPolicy()
        );
    }

    /**
     * 定时任务线程池（模式检查、目标刷新、死信清理）
     */
    @Bean("taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("scheduled-task-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
