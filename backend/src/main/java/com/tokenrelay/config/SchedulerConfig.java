package com.tokenrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool for component-owned periodic tasks: cache sweep, rate-limiter drain, endpoint probes,
 * broadcast poll and keep-alive. Tasks are scheduled by their owners and cancelled in their close().
 */
@Configuration
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "relay-scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler relaySchedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("relay-scheduler-");
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.initialize();
        return s;
    }
}
