package com.chainindexer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pool for per-block transaction fan-out. Transactions never share state, so the pool only bounds
 * CPU use; BlockTransformProcessor caps in-flight work per block on top of it.
 */
@Configuration
public class AsyncConfig {

    public static final String TRANSFORM_EXECUTOR = "transform-executor";

    @Bean(name = TRANSFORM_EXECUTOR)
    public Executor transformExecutor(
            @Value("${chainindexer.transform.executor.core-pool-size:4}") int corePoolSize,
            @Value("${chainindexer.transform.executor.max-pool-size:8}") int maxPoolSize) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(corePoolSize);
        e.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        e.setThreadNamePrefix("transform-");
        e.initialize();
        return e;
    }
}
