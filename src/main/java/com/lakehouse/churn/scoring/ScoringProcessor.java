package com.lakehouse.churn.scoring;

import com.lakehouse.churn.domain.FeatureRecord;
import com.lakehouse.churn.domain.ScoredRecord;
import com.lakehouse.churn.metrics.PipelineMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.infrastructure.item.ItemProcessor;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;

/**
 * FeatureRecord 에 이탈 예측을 붙이는 Processor
 * <p>
 * 모델 호출은 TimeLimiter(시간 제한)와 Retry(일시적 실패 재시도)로 감쌉니다.
 * 한 레코드의 실패나 시간 초과는 scoringFailed 로 표시될 뿐 배치를 중단시키지 않습니다.
 */
@Slf4j
public class ScoringProcessor implements ItemProcessor<FeatureRecord, ScoredRecord>, AutoCloseable {

    private final ChurnScorer scorer;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final PipelineMetrics metrics;
    private final ExecutorService executor;

    public ScoringProcessor(ChurnScorer scorer, Retry retry, TimeLimiter timeLimiter, PipelineMetrics metrics) {
        List<String> unknown = scorer.inputSchema().stream()
                .filter(column -> !FeatureRecord.COLUMNS.contains(column))
                .toList();
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Scorer " + scorer.model() + " declares unknown input columns "
                    + unknown);
        }
        this.scorer = scorer;
        this.retry = retry;
        this.timeLimiter = timeLimiter;
        this.metrics = metrics;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("scoring-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newCachedThreadPool(threadFactory);
    }

    @Override
    public ScoredRecord process(FeatureRecord features) {
        ModelReference model = scorer.model();
        Map<String, Object> input = toInput(features);

        ScoredRecord result;
        try {
            Integer prediction = retry.executeCallable(() ->
                    timeLimiter.executeFutureSupplier(() -> executor.submit(() -> scorer.score(input))));
            result = ScoredRecord.scored(features, prediction, model.name(), model.version());
        } catch (TimeoutException e) {
            String reason = "timed out after " + timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
            log.warn("Scoring user {} with {} {}", features.userId(), model, reason);
            result = ScoredRecord.failed(features, reason, model.name(), model.version());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Scoring user {} with {} failed: {}", features.userId(), model, e.toString());
            result = ScoredRecord.failed(features, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    model.name(), model.version());
        }

        metrics.recordScoring(result);
        return result;
    }

    Map<String, Object> toInput(FeatureRecord features) {
        Map<String, Object> input = new LinkedHashMap<>();
        for (String column : scorer.inputSchema()) {
            Object value = features.column(column);
            input.put(column, value instanceof TemporalAccessor ? value.toString() : value);
        }
        return input;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
