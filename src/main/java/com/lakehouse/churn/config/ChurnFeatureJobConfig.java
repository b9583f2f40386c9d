package com.lakehouse.churn.config;

import com.lakehouse.churn.domain.FeatureRecord;
import com.lakehouse.churn.domain.ScoredRecord;
import com.lakehouse.churn.feature.FeatureRepository;
import com.lakehouse.churn.feature.FeatureTasklet;
import com.lakehouse.churn.scoring.PredictionRepository;
import com.lakehouse.churn.scoring.ScoringProcessor;
import lombok.RequiredArgsConstructor;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.flow.Flow;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcCursorItemReader;
import org.springframework.batch.infrastructure.item.database.builder.JdbcCursorItemReaderBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * churnFeatureJob 설정
 * <p>
 * JobParameters:
 * - inputRoot (String, identifying): 원천 디렉터리(users / orders / events)의 상위 경로
 * - evaluationInstant (String, identifying): days_* 피처 계산 기준 시각 (yyyy-MM-ddTHH:mm:ss)
 * <p>
 * 처리 흐름: sourceSplitFlow (원천별 적재 → 정제, 병렬) → featureStep (집계) → scoringStep (예측)
 */
@Configuration
@RequiredArgsConstructor
public class ChurnFeatureJobConfig {

    public static final String JOB_NAME = "churnFeatureJob";

    private final JobRepository jobRepository;
    private final PipelineProperties properties;

    @Bean
    public Job churnFeatureJob(Flow sourceSplitFlow, Step featureStep, Step scoringStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
                .start(sourceSplitFlow)
                .next(featureStep)
                .next(scoringStep)
                .end()
                .build();
    }

    @Bean
    public Step featureStep(FeatureTasklet featureTasklet, PlatformTransactionManager transactionManager) {
        return new StepBuilder("features", jobRepository)
                .tasklet(featureTasklet, transactionManager)
                .build();
    }

    @Bean
    public Step scoringStep(JdbcCursorItemReader<FeatureRecord> featureReader,
                            ScoringProcessor scoringProcessor,
                            ItemWriter<ScoredRecord> predictionWriter) {
        return new StepBuilder("scoring", jobRepository)
                .<FeatureRecord, ScoredRecord>chunk(properties.getChunkSize())
                .reader(featureReader)
                .processor(scoringProcessor)
                .writer(predictionWriter)
                .build();
    }

    @Bean
    public JdbcCursorItemReader<FeatureRecord> featureReader(DataSource dataSource) {
        return new JdbcCursorItemReaderBuilder<FeatureRecord>()
                .name("featureReader")
                .dataSource(dataSource)
                .sql("SELECT * FROM churn_features ORDER BY user_id")
                .rowMapper(FeatureRepository.ROW_MAPPER)
                .saveState(false)
                .build();
    }

    /**
     * 예측 결과를 chunk 단위 트랜잭션으로 churn_prediction 에 upsert 하는 Writer
     */
    @Bean
    public ItemWriter<ScoredRecord> predictionWriter(PredictionRepository predictionRepository,
                                                     TransactionTemplate transactionTemplate) {
        return chunk -> transactionTemplate.executeWithoutResult(
                status -> predictionRepository.saveAll(chunk.getItems()));
    }
}
