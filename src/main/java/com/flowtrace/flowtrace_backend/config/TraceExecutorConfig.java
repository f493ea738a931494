package com.flowtrace.flowtrace_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools for the trace engine: one for the concurrent sub-fetches of projection and assembly,
 * one scheduler for live-view polling.
 */
@Configuration
@EnableConfigurationProperties(FlowtraceProperties.class)
public class TraceExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "traceFetchExecutor")
    public ThreadPoolTaskExecutor traceFetchExecutor(FlowtraceProperties properties) {
        int poolSize = Math.max(1, properties.getFetch().getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("trace-fetch-");
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(500);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "liveViewScheduler")
    public TaskScheduler liveViewScheduler(FlowtraceProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, properties.getLive().getSchedulerPoolSize()));
        scheduler.setThreadNamePrefix("live-view-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
