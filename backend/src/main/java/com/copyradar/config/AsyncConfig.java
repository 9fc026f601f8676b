package com.copyradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. similarity-executor runs account sweeps off the ingestion and scheduler threads.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String SIMILARITY_EXECUTOR = "similarity-executor";

    @Bean(name = SIMILARITY_EXECUTOR)
    public Executor similarityExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("similarity-");
        e.initialize();
        return e;
    }
}
