package com.ledgerimport.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: categorization-executor runs background batch categorization so imports return as soon as
 * the batch is staged; reconciliation-executor fans out budget variance alerts.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String CATEGORIZATION_EXECUTOR = "categorization-executor";
    public static final String RECONCILIATION_EXECUTOR = "reconciliation-executor";

    @Bean(name = CATEGORIZATION_EXECUTOR)
    public Executor categorizationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("categorize-");
        e.initialize();
        return e;
    }

    @Bean(name = RECONCILIATION_EXECUTOR)
    public Executor reconciliationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("reconcile-");
        e.initialize();
        return e;
    }
}
