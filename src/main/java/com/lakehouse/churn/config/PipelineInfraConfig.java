package com.lakehouse.churn.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lakehouse.churn.scoring.TransientScoringException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;

/**
 * 파이프라인 공통 인프라 Bean
 * <p>
 * 재시도 / 타임아웃은 resilience4j, 메트릭은 Micrometer 를 사용합니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineInfraConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    /**
     * 저장소 접근(IOException) 재시도. 소진되면 StorageAccessException 으로 단계가 실패합니다.
     */
    @Bean
    public Retry storageRetry(PipelineProperties properties) {
        PipelineProperties.RetrySettings settings = properties.getStorageRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoff(), settings.getMultiplier()))
                .retryOnException(e -> e instanceof IOException || e instanceof UncheckedIOException)
                .build();
        Retry retry = Retry.of("storage", config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying storage access (attempt {}): {}",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().toString()));
        return retry;
    }

    @Bean
    public Retry scoringRetry(PipelineProperties properties) {
        PipelineProperties.RetrySettings settings = properties.getScoring().getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoff(), settings.getMultiplier()))
                .retryOnException(e -> e instanceof TransientScoringException)
                .build();
        return Retry.of("scoring", config);
    }

    @Bean
    public TimeLimiter scoringTimeLimiter(PipelineProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getScoring().getTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("scoring", config);
    }
}
