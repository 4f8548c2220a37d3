package com.daytrader.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for asynchronous event listeners (notifications) and for strategy evaluation.
 *
 * <p>Strategy evaluation runs on its own pool so that the engine can abandon an evaluation
 * that exceeds its timeout without blocking the tick thread.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${daytrader.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${daytrader.async.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${daytrader.async.queue-capacity:500}")
    private int queueCapacity;

    @Value("${daytrader.async.strategy-pool-size:2}")
    private int strategyPoolSize;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("strategyExecutor")
    public ThreadPoolTaskExecutor strategyExecutor() {
        return newStrategyExecutor(strategyPoolSize);
    }

    /**
     * Fixed pool without a queue. When every thread is held by a hung evaluation, further
     * submissions are rejected and never run on the tick thread.
     */
    public static ThreadPoolTaskExecutor newStrategyExecutor(int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("strategy-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
