package com.chatauth.backend.global.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool for Argon2 work so hashing bursts stay off the request threads.
 */
@Configuration
public class PasswordHashingExecutorConfig {

    public static final String PASSWORD_HASHING_EXECUTOR = "passwordHashingExecutor";

    @Bean(PASSWORD_HASHING_EXECUTOR)
    public ThreadPoolTaskExecutor passwordHashingExecutor(HashingProperties properties) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(properties.poolSize());
        ex.setMaxPoolSize(properties.poolSize());
        ex.setQueueCapacity(properties.queueCapacity());
        ex.setThreadNamePrefix("pwd-hash-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }
}
