package com.lakehouse.churn.schedule;

import com.lakehouse.churn.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * churn.pipeline.schedule.enabled=true 일 때만 주기 실행을 켭니다.
 * <p>
 * schedule 프로필은 기동 시 잡 자동 실행(spring.batch.job.enabled)도 함께 끕니다.
 */
@Slf4j
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "churn.pipeline.schedule", name = "enabled", havingValue = "true")
public class ScheduleConfig {

    @Bean
    public ChurnPipelineScheduler churnPipelineScheduler(JobOperator jobOperator, Job churnFeatureJob,
                                                         PipelineProperties properties, Clock clock,
                                                         Environment environment) {
        if (properties.getSchedule().getInputRoot() == null) {
            throw new IllegalStateException("churn.pipeline.schedule.input-root is required when scheduling is enabled");
        }
        if (environment.getProperty("spring.batch.job.enabled", Boolean.class, true)) {
            log.warn("Scheduling is enabled but spring.batch.job.enabled=true; the startup launch without "
                    + "job parameters will fail. Activate the 'schedule' profile or set spring.batch.job.enabled=false");
        }
        return new ChurnPipelineScheduler(jobOperator, churnFeatureJob, properties, clock);
    }
}
