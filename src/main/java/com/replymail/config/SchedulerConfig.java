package com.replymail.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Pipeline scheduler threads
 * - One thread for the interval timer, one for manual triggers
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public ThreadPoolTaskScheduler pipelineTaskScheduler(AssistantProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("replymail-pipeline-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationMillis(properties.getPolling().getShutdownGraceMs());
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
