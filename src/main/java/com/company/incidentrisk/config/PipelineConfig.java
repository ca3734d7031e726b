package com.company.incidentrisk.config;

import com.company.incidentrisk.exception.StoreUnavailableException;
import com.company.incidentrisk.util.BucketWindows;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Shared pipeline beans: time source, bucket arithmetic, ETL workers and the per-bucket retry policy.
 */
@Configuration
@Slf4j
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BucketWindows bucketWindows(IncidentRiskProperties properties) {
        IncidentRiskProperties.Etl etl = properties.getEtl();
        return new BucketWindows(etl.getBucketWidth(), etl.getWatermarkDelay(), etl.getAllowedLateness());
    }

    @Bean(name = "etlExecutor")
    public Executor etlExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("etl-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Retry etlBucketRetry(IncidentRiskProperties properties) {
        IncidentRiskProperties.Etl etl = properties.getEtl();

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(etl.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(etl.getRetryBackoff(), 2.0))
                .retryExceptions(StoreUnavailableException.class, DataAccessException.class)
                .build();

        Retry retry = Retry.of("etlBucket", config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying bucket computation (attempt {}): {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
