package com.perptrader.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Shared pools for the bot runs. Each run owns its own single-thread scheduler; these
 * pools carry the per-symbol market-data fetches and the time-bounded strategy calls.
 */
@Configuration
public class AsyncConfig {

    @Value("${perptrader.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${perptrader.async.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${perptrader.async.queue-capacity:100}")
    private int queueCapacity;

    @Bean("marketDataExecutor")
    public ThreadPoolTaskExecutor marketDataExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("market-data-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /** Strategy evaluations that overrun their deadline are interrupted, so threads come and go. */
    @Bean(name = "strategyExecutor", destroyMethod = "shutdownNow")
    public ExecutorService strategyExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("strategy-"));
    }
}
