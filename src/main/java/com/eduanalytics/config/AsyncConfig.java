package com.eduanalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for ETL jobs.
 *
 * A full queue rejects the submission instead of running the job on the request thread;
 * the submitting service marks such a job as failed.
 */
@Slf4j
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${app.async.etl.core-pool-size:2}")
    private int etlCorePoolSize;

    @Value("${app.async.etl.max-pool-size:4}")
    private int etlMaxPoolSize;

    @Value("${app.async.etl.queue-capacity:100}")
    private int etlQueueCapacity;

    @Value("${app.async.etl.keep-alive-seconds:60}")
    private int etlKeepAliveSeconds;

    @Bean(name = "etlTaskExecutor")
    public ThreadPoolTaskExecutor etlTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(etlCorePoolSize);
        executor.setMaxPoolSize(etlMaxPoolSize);
        executor.setQueueCapacity(etlQueueCapacity);
        executor.setKeepAliveSeconds(etlKeepAliveSeconds);
        executor.setThreadNamePrefix("etl-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // running jobs get a chance to write their final counters
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("ETL Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                etlCorePoolSize, etlMaxPoolSize, etlQueueCapacity, etlKeepAliveSeconds);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return etlTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) -> log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                method.getDeclaringClass().getSimpleName(),
                method.getName(),
                Arrays.toString(params), ex);
    }
}
