package com.deepansh.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated thread pool for background orchestration sessions.
 *
 * Isolated from the web thread pool so long-running sessions (up to ten
 * model rounds each) never starve HTTP request handling.
 * One session occupies one thread for its whole lifetime; tool calls inside
 * a session stay sequential.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "sessionTaskExecutor")
    public ThreadPoolTaskExecutor sessionTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("session-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
