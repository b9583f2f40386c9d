package com.lakehouse.churn.config;

import com.lakehouse.churn.clean.Coercions;
import com.lakehouse.churn.domain.FeatureRecord;
import com.lakehouse.churn.domain.ScoredRecord;
import com.lakehouse.churn.domain.SourceName;
import com.lakehouse.churn.feature.FeatureRepository;
import com.lakehouse.churn.metrics.PipelineMetrics;
import com.lakehouse.churn.scoring.PredictionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.step.StepExecution;
import org.springframework.batch.test.JobLauncherTestUtils;
import org.springframework.batch.test.JobScopeTestExecutionListener;
import org.springframework.batch.test.JobRepositoryTestUtils;
import org.springframework.batch.test.context.SpringBatchTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestExecutionListeners;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * churnFeatureJob 테스트
 *
 * 증분 처리 검증:
 * - 원천 적재 → 정제 → 집계 → 스코어링 전 과정
 * - 새 파일만 적재, 이미 처리한 micro-batch 재처리 시 중복 없음
 * - malformed / 제외 레코드 집계
 */
@SpringBatchTest
@TestExecutionListeners(listeners = JobScopeTestExecutionListener.class, mergeMode = TestExecutionListeners.MergeMode.MERGE_WITH_DEFAULTS)
@SpringBootTest
@ActiveProfiles("test")
class ChurnFeatureJobTest {

    @Autowired
    private JobLauncherTestUtils jobLauncherTestUtils;

    @Autowired
    private JobRepositoryTestUtils jobRepositoryTestUtils;

    @Autowired
    private Job churnFeatureJob;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private FeatureRepository featureRepository;

    @Autowired
    private PredictionRepository predictionRepository;

    @Autowired
    private PipelineMetrics metrics;

    @TempDir
    Path inputRoot;

    @BeforeEach
    void setUp() throws IOException {
        jobRepositoryTestUtils.removeJobExecutions();
        jobLauncherTestUtils.setJob(churnFeatureJob);
        // 테스트 전 파이프라인 테이블 초기화
        for (String table : List.of("churn_prediction", "churn_features", "churn_app_events", "churn_orders",
                "churn_users", "stage_offset", "ingested_file", "raw_record")) {
            jdbcTemplate.execute("DELETE FROM " + table);
        }

        copyFixture("users", "users_1.json");
        copyFixture("orders", "orders_1.json");
        copyFixture("events", "events_1.csv");
    }

    @Test
    @DisplayName("원천 파일을 적재 / 정제 / 집계 / 스코어링하여 사용자별 피처와 예측을 생성")
    void 전체_파이프라인_성공() throws Exception {
        // given
        double malformedBefore = metrics.count(PipelineMetrics.CLEAN_RECORDS, "source", "users", "outcome", "malformed");

        // when
        JobExecution execution = jobLauncherTestUtils.launchJob(params("2020-03-01T00:00:00"));

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(stepNames(execution)).contains(
                "ingest.users", "clean.users", "ingest.orders", "clean.orders",
                "ingest.events", "clean.events", "features", "scoring");

        // 사용자 id 가 null 인 줄은 제외, 깨진 JSON 줄은 malformed
        assertThat(count("churn_users")).isEqualTo(2);
        assertThat(count("churn_orders")).isEqualTo(1);
        assertThat(count("churn_app_events")).isEqualTo(2);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM raw_record WHERE malformed = TRUE", Integer.class)).isEqualTo(1);
        assertThat(metrics.count(PipelineMetrics.CLEAN_RECORDS, "source", "users", "outcome", "malformed")
                - malformedBefore).isEqualTo(1.0);

        // 주문 / 이벤트가 모두 있는 사용자 1 만 inner join 결과에 포함
        List<FeatureRecord> features = featureRepository.findAll();
        assertThat(features).hasSize(1);
        FeatureRecord feature = features.get(0);
        assertThat(feature.userId()).isEqualTo("1");
        assertThat(feature.orderCount()).isEqualTo(1);
        assertThat(feature.totalAmount()).isEqualTo(50L);
        assertThat(feature.totalItem()).isEqualTo(2L);
        assertThat(feature.eventCount()).isEqualTo(2);
        assertThat(feature.sessionCount()).isEqualTo(1);
        assertThat(feature.platform()).isEqualTo("ios");
        assertThat(feature.daysSinceCreation()).isEqualTo(60L);
        assertThat(feature.daysSinceLastActivity()).isEqualTo(15L);
        assertThat(feature.daysLastEvent()).isEqualTo(29L);
        assertThat(feature.user().firstname()).isEqualTo("Jane");
        assertThat(feature.user().email()).isEqualTo(Coercions.sha1("Jane.Doe@example.com"));

        // endpoint 미설정 → 비활동 기준 스코어러 (29일 <= 30일)
        List<ScoredRecord> predictions = predictionRepository.findAll();
        assertThat(predictions).hasSize(1);
        assertThat(predictions.get(0).churnPrediction()).isEqualTo(0);
        assertThat(predictions.get(0).scoringFailed()).isFalse();
        assertThat(predictions.get(0).modelName()).isEqualTo("inactivity_baseline");
    }

    @Test
    @DisplayName("새 파일만 적재하고 이미 적재된 주문은 다시 집계하지 않음")
    void 증분_적재_중복없음() throws Exception {
        // given
        jobLauncherTestUtils.launchJob(params("2020-03-01T00:00:00"));
        copyFixture("orders", "orders_2.json");

        // when
        JobExecution execution = jobLauncherTestUtils.launchJob(params("2020-03-02T00:00:00"));

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(rawCount(SourceName.ORDERS)).isEqualTo(4);
        assertThat(rawCount(SourceName.USERS)).isEqualTo(4);
        assertThat(step(execution, "clean.users").getReadCount()).isZero();
        assertThat(step(execution, "clean.orders").getReadCount()).isEqualTo(2);

        // orders_2 의 주문 10 은 이미 있으므로 주문 11 만 추가
        FeatureRecord feature = featureRepository.findAll().get(0);
        assertThat(feature.orderCount()).isEqualTo(2);
        assertThat(feature.totalAmount()).isEqualTo(70L);
        assertThat(feature.totalItem()).isEqualTo(3L);
        assertThat(feature.daysLastEvent()).isEqualTo(30L);
    }

    @Test
    @DisplayName("새 파일이 없으면 적재 / 정제 단계는 빈 실행으로 끝나고 결과는 그대로")
    void 새파일없음_빈실행() throws Exception {
        // given
        jobLauncherTestUtils.launchJob(params("2020-03-01T00:00:00"));
        Integer rawBefore = count("raw_record");

        // when
        JobExecution execution = jobLauncherTestUtils.launchJob(params("2020-03-01T12:00:00"));

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(count("raw_record")).isEqualTo(rawBefore);
        for (SourceName source : SourceName.values()) {
            assertThat(step(execution, source.cleanStage()).getReadCount()).isZero();
        }
        assertThat(featureRepository.findAll()).hasSize(1);
    }

    @Test
    @DisplayName("정제 체크포인트를 잃고 같은 micro-batch 를 재처리해도 silver 테이블에 중복이 생기지 않음")
    void 재처리_멱등() throws Exception {
        // given
        jobLauncherTestUtils.launchJob(params("2020-03-01T00:00:00"));
        jdbcTemplate.update("DELETE FROM stage_offset WHERE stage = ?", SourceName.ORDERS.cleanStage());
        jdbcTemplate.update("DELETE FROM stage_offset WHERE stage = ?", SourceName.EVENTS.cleanStage());

        // when
        JobExecution execution = jobLauncherTestUtils.launchJob(params("2020-03-01T06:00:00"));

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(step(execution, "clean.orders").getReadCount()).isEqualTo(2);
        assertThat(count("churn_orders")).isEqualTo(1);
        assertThat(count("churn_app_events")).isEqualTo(2);

        FeatureRecord feature = featureRepository.findAll().get(0);
        assertThat(feature.orderCount()).isEqualTo(1);
        assertThat(feature.eventCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("evaluationInstant 가 없으면 집계 단계에서 실패")
    void 기준시각_누락_실패() throws Exception {
        // given
        JobParameters params = new JobParametersBuilder()
                .addString("inputRoot", inputRoot.toString(), true)
                .toJobParameters();

        // when
        JobExecution execution = jobLauncherTestUtils.launchJob(params);

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(step(execution, "features").getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(count("churn_features")).isZero();
    }

    private JobParameters params(String evaluationInstant) {
        return new JobParametersBuilder()
                .addString("inputRoot", inputRoot.toString(), true)
                .addString("evaluationInstant", evaluationInstant, true)
                .toJobParameters();
    }

    private void copyFixture(String source, String fileName) throws IOException {
        Path dir = Files.createDirectories(inputRoot.resolve(source));
        try (InputStream in = new ClassPathResource("fixtures/" + source + "/" + fileName).getInputStream()) {
            Files.copy(in, dir.resolve(fileName));
        }
    }

    private Integer count(String table) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    }

    private Integer rawCount(SourceName source) {
        return jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM raw_record WHERE source = ?", Integer.class, source.name());
    }

    private static List<String> stepNames(JobExecution execution) {
        return execution.getStepExecutions().stream().map(StepExecution::getStepName).toList();
    }

    private static StepExecution step(JobExecution execution, String name) {
        Map<String, StepExecution> byName = execution.getStepExecutions().stream()
                .collect(Collectors.toMap(StepExecution::getStepName, step -> step));
        assertThat(byName).containsKey(name);
        return byName.get(name);
    }
}
