package com.starscape.mediavault.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class JobExecutorConfig {

    /**
     * Runs background import and regeneration jobs. Only one job is ever claimed
     * at a time, so a single worker is enough; the small queue absorbs a new job
     * submitted while the previous worker is still unwinding.
     */
    @Bean(name = "mediaJobExecutor")
    public Executor mediaJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(2);
        executor.setThreadNamePrefix("media-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
