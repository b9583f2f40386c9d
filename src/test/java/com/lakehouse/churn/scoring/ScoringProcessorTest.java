package com.lakehouse.churn.scoring;

import com.lakehouse.churn.domain.FeatureRecord;
import com.lakehouse.churn.domain.ScoredRecord;
import com.lakehouse.churn.domain.UserRecord;
import com.lakehouse.churn.metrics.PipelineMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoringProcessorTest {

    private static final ModelReference MODEL = new ModelReference("churn_test", "1");
    private static final List<String> INPUT = List.of("user_id", "order_count", "last_event", "days_last_event");

    private final PipelineMetrics metrics = new PipelineMetrics(new SimpleMeterRegistry());

    private final Retry retry = Retry.of("scoring-test", RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(1))
            .retryOnException(e -> e instanceof TransientScoringException)
            .build());

    private final TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofMillis(200))
            .cancelRunningFuture(true)
            .build());

    private ScoringProcessor processor;

    @AfterEach
    void tearDown() {
        if (processor != null) {
            processor.close();
        }
    }

    @Test
    @DisplayName("선언된 입력 컬럼만 전달하고 예측값을 붙임")
    void 예측_성공() {
        // given
        processor = processor(input -> {
            assertThat(input).containsOnlyKeys(INPUT);
            assertThat(input.get("last_event")).isEqualTo("2020-02-01T00:00");
            return 1;
        });

        // when
        ScoredRecord scored = processor.process(feature("1"));

        // then
        assertThat(scored.churnPrediction()).isEqualTo(1);
        assertThat(scored.scoringFailed()).isFalse();
        assertThat(scored.modelName()).isEqualTo("churn_test");
        assertThat(scored.modelVersion()).isEqualTo("1");
        assertThat(metrics.count(PipelineMetrics.SCORED_RECORDS, "model", "churn_test", "outcome", "scored"))
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("한 레코드의 시간 초과는 실패로 표시되고 다음 레코드는 정상 처리")
    void 시간초과_실패표시() {
        // given
        processor = processor(input -> {
            if ("slow".equals(input.get("user_id"))) {
                sleep(5_000);
            }
            return 0;
        });

        // when
        ScoredRecord slow = processor.process(feature("slow"));
        ScoredRecord fast = processor.process(feature("fast"));

        // then
        assertThat(slow.scoringFailed()).isTrue();
        assertThat(slow.churnPrediction()).isNull();
        assertThat(slow.failureReason()).contains("timed out");
        assertThat(fast.scoringFailed()).isFalse();
        assertThat(fast.churnPrediction()).isEqualTo(0);
        assertThat(metrics.count(PipelineMetrics.SCORED_RECORDS, "model", "churn_test", "outcome", "failed"))
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("일시적 오류는 재시도하여 성공")
    void 일시적오류_재시도() {
        // given
        AtomicInteger calls = new AtomicInteger();
        processor = processor(input -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientScoringException("503 from model server");
            }
            return 1;
        });

        // when
        ScoredRecord scored = processor.process(feature("1"));

        // then
        assertThat(scored.scoringFailed()).isFalse();
        assertThat(scored.churnPrediction()).isEqualTo(1);
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("그 외 오류는 재시도 없이 실패로 표시")
    void 영구오류_실패표시() {
        // given
        AtomicInteger calls = new AtomicInteger();
        processor = processor(input -> {
            calls.incrementAndGet();
            throw new ScoringException("400 Bad Request");
        });

        // when
        ScoredRecord scored = processor.process(feature("1"));

        // then
        assertThat(scored.scoringFailed()).isTrue();
        assertThat(scored.failureReason()).contains("400 Bad Request");
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("피처에 없는 입력 컬럼을 선언한 스코어러는 거부")
    void 알수없는_입력컬럼_거부() {
        ChurnScorer scorer = new StubScorer(List.of("user_id", "lifetime_value"), input -> 0);

        assertThatThrownBy(() -> new ScoringProcessor(scorer, retry, timeLimiter, metrics))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lifetime_value");
    }

    @Test
    @DisplayName("기준 스코어러는 마지막 이벤트 경과일이 임계값을 넘으면 이탈")
    void 비활동_기준_스코어러() {
        InactivityChurnScorer scorer = new InactivityChurnScorer(MODEL, INPUT, 30);

        assertThat(scorer.score(Map.of("days_last_event", 31L))).isEqualTo(1);
        assertThat(scorer.score(Map.of("days_last_event", 30L))).isEqualTo(0);
        assertThat(scorer.score(Map.of("user_id", "1"))).isNull();
    }

    private ScoringProcessor processor(Function<Map<String, Object>, Integer> scoring) {
        return new ScoringProcessor(new StubScorer(INPUT, scoring), retry, timeLimiter, metrics);
    }

    private static FeatureRecord feature(String userId) {
        UserRecord user = new UserRecord(userId, null, null, null, null, null, null, null, null,
                null, null, null);
        return new FeatureRecord(user, 2, 100L, 3L, null, "ios", 4, 1,
                LocalDateTime.of(2020, 2, 1, 0, 0), null, null, 29L);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record StubScorer(List<String> inputSchema, Function<Map<String, Object>, Integer> scoring)
            implements ChurnScorer {

        @Override
        public ModelReference model() {
            return MODEL;
        }

        @Override
        public Integer score(Map<String, Object> input) {
            return scoring.apply(input);
        }
    }
}
