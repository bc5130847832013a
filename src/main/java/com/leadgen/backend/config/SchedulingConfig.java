package com.leadgen.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@Slf4j
public class SchedulingConfig {

    public static final String CAMPAIGN_RUNNER = "campaignRunnerExecutor";
    public static final String ITEM_WORKERS = "itemWorkerExecutor";

    /**
     * Heartbeats, stale detection, domain blocks and phase deadlines all read time from here
     */
    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    /**
     * One thread per concurrently running campaign drive loop
     */
    @Bean(name = CAMPAIGN_RUNNER)
    public ThreadPoolTaskExecutor campaignRunnerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("campaign-runner-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Bounded pool for the work items of one coverage unit. Kept below every capability's
     * concurrency ceiling so the scheduler's slots are the only limiting layer.
     */
    @Bean(name = ITEM_WORKERS)
    public ThreadPoolTaskExecutor itemWorkerExecutor(EngineProperties engineProperties,
                                                     RateBudgetProperties rateBudgetProperties) {
        int workers = engineProperties.workerPoolSize();
        int minConcurrency = rateBudgetProperties.minConcurrency();
        if (workers < 1 || workers >= minConcurrency) {
            throw new IllegalStateException("leadgen.engine.worker-pool-size (" + workers
                    + ") must be at least 1 and below the smallest capability max-concurrent (" + minConcurrency + ")");
        }

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("campaign-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        log.info("Item worker pool sized at {} (smallest capability concurrency {})", workers, minConcurrency);
        return executor;
    }
}
