package com.example.toolgateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for backend tool calls and per-user gateway construction.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "backendExecutor")
    public ThreadPoolTaskExecutor backendExecutor(GatewayProperties properties) {
        int poolSize = properties.getBackend().getExecutorPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("backend-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "gatewayBuildExecutor")
    public ThreadPoolTaskExecutor gatewayBuildExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(10);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("gateway-build-");
        executor.initialize();
        return executor;
    }
}
