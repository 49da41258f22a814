package com.outcast.rivalry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class FetchExecutorConfig {

    @Bean(name = "rivalryFetchExecutor")
    public ThreadPoolTaskExecutor rivalryFetchExecutor(RivalryProperties properties) {
        int workers = Math.max(1, properties.getMaxConcurrency());
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(workers);
        exec.setMaxPoolSize(workers);
        // a batch never queues more than batchSize tasks, several concurrent runs may share the pool
        exec.setQueueCapacity(Math.max(100, properties.getBatchSize() * 20));
        exec.setThreadNamePrefix("RivalryFetch-");
        exec.initialize();
        return exec;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
