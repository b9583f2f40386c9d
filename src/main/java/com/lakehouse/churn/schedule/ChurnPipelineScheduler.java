package com.lakehouse.churn.schedule;

import com.lakehouse.churn.config.PipelineProperties;
import com.lakehouse.churn.feature.FeatureTasklet;
import com.lakehouse.churn.ingest.IngestionTasklet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * 새 원천 파일을 주기적으로 처리하는 스케줄러
 * <p>
 * 실행마다 evaluationInstant 가 달라지므로 매번 새 JobInstance 가 만들어집니다.
 * 새 파일이 없으면 적재 / 정제 단계는 빈 실행으로 끝납니다.
 */
@Slf4j
@RequiredArgsConstructor
public class ChurnPipelineScheduler {

    private final JobOperator jobOperator;
    private final Job churnFeatureJob;
    private final PipelineProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${churn.pipeline.schedule.poll-interval:PT1M}")
    public void poll() {
        String inputRoot = properties.getSchedule().getInputRoot();
        LocalDateTime evaluationInstant = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        JobParameters params = new JobParametersBuilder()
                .addString(IngestionTasklet.INPUT_ROOT, inputRoot, true)
                .addString(FeatureTasklet.EVALUATION_INSTANT, evaluationInstant.toString(), true)
                .toJobParameters();

        try {
            JobExecution execution = jobOperator.start(churnFeatureJob, params);
            log.info("{} finished with {} (evaluationInstant={})",
                    churnFeatureJob.getName(), execution.getStatus(), evaluationInstant);
        } catch (Exception e) {
            // 다음 주기에 다시 시도
            log.error("{} launch failed (evaluationInstant={})", churnFeatureJob.getName(), evaluationInstant, e);
        }
    }
}
