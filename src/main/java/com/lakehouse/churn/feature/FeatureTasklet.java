package com.lakehouse.churn.feature;

import com.lakehouse.churn.clean.SilverRecordRepository;
import com.lakehouse.churn.metrics.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * silver 테이블 전체를 읽어 churn_features 를 다시 계산하는 Tasklet
 * <p>
 * 기준 시각은 잡 파라미터 evaluationInstant (ISO-8601 local date-time) 로 명시적으로 받습니다.
 * 같은 입력과 같은 기준 시각이면 항상 같은 결과가 나옵니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureTasklet implements Tasklet {

    public static final String EVALUATION_INSTANT = "evaluationInstant";

    private final SilverRecordRepository silverRecordRepository;
    private final FeatureRepository featureRepository;
    private final FeatureAggregator aggregator;
    private final PipelineMetrics metrics;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        String value = chunkContext.getStepContext().getStepExecution()
                .getJobParameters().getString(EVALUATION_INSTANT);
        LocalDateTime evaluationInstant = parseEvaluationInstant(value);

        FeatureResult result = aggregator.aggregate(
                silverRecordRepository.findAllUsers(),
                silverRecordRepository.findAllOrders(),
                silverRecordRepository.findAllEvents(),
                evaluationInstant);

        featureRepository.replaceAll(result.features());
        metrics.recordJoin(result.joinReport());
        log.info("Rebuilt churn_features with {} users as of {}", result.features().size(), evaluationInstant);
        return RepeatStatus.FINISHED;
    }

    static LocalDateTime parseEvaluationInstant(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Job parameter '" + EVALUATION_INSTANT + "' is required");
        }
        try {
            return LocalDateTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid " + EVALUATION_INSTANT + ": " + value, e);
        }
    }
}
