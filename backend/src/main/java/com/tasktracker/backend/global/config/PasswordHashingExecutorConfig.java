package com.tasktracker.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated pool for bcrypt work.
 *
 * <p>Hashing is deliberately slow. Running it on a bounded pool keeps a burst of
 * login attempts from occupying every servlet thread; once the queue is full new
 * jobs are rejected instead of piling up.
 */
@Configuration
public class PasswordHashingExecutorConfig {

    @Bean(name = "passwordHashingExecutor")
    public ThreadPoolTaskExecutor passwordHashingExecutor(
            @Value("${app.auth.password-hashing.pool-size:4}") int poolSize,
            @Value("${app.auth.password-hashing.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("pwd-hash-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
