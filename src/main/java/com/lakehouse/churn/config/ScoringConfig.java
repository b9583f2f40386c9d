package com.lakehouse.churn.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lakehouse.churn.metrics.PipelineMetrics;
import com.lakehouse.churn.scoring.ChurnScorer;
import com.lakehouse.churn.scoring.InactivityChurnScorer;
import com.lakehouse.churn.scoring.ModelReference;
import com.lakehouse.churn.scoring.RestModelScorer;
import com.lakehouse.churn.scoring.ScoringProcessor;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * 스코어링 설정
 * <p>
 * churn.pipeline.scoring.endpoint 가 있으면 MLflow 서빙 엔드포인트를 호출하고,
 * 없으면 비활동 기간 기준 스코어러를 사용합니다.
 */
@Slf4j
@Configuration
public class ScoringConfig {

    @Bean
    @ConditionalOnProperty(prefix = "churn.pipeline.scoring", name = "endpoint")
    public ChurnScorer restModelScorer(PipelineProperties properties, ObjectMapper objectMapper) {
        PipelineProperties.Scoring scoring = properties.getScoring();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(scoring.getTimeout());
        requestFactory.setReadTimeout(scoring.getTimeout());

        log.info("Scoring with model endpoint {}", scoring.getEndpoint());
        return new RestModelScorer(
                new RestTemplate(requestFactory),
                URI.create(scoring.getEndpoint()),
                objectMapper,
                new ModelReference(scoring.getModelName(), scoring.getModelVersion()),
                scoring.getInputColumns());
    }

    @Bean
    @ConditionalOnMissingBean(ChurnScorer.class)
    public ChurnScorer inactivityChurnScorer(PipelineProperties properties) {
        PipelineProperties.Scoring scoring = properties.getScoring();
        log.info("No scoring endpoint configured, churn = days_last_event > {}",
                scoring.getInactivityThresholdDays());
        return new InactivityChurnScorer(
                new ModelReference("inactivity_baseline", "days_last_event>" + scoring.getInactivityThresholdDays()),
                scoring.getInputColumns(),
                scoring.getInactivityThresholdDays());
    }

    @Bean
    public ScoringProcessor scoringProcessor(ChurnScorer churnScorer,
                                             @Qualifier("scoringRetry") Retry scoringRetry,
                                             @Qualifier("scoringTimeLimiter") TimeLimiter scoringTimeLimiter,
                                             PipelineMetrics metrics) {
        return new ScoringProcessor(churnScorer, scoringRetry, scoringTimeLimiter, metrics);
    }
}
