package com.lakehouse.churn.metrics;

import com.lakehouse.churn.clean.CleaningReport;
import com.lakehouse.churn.domain.ScoredRecord;
import com.lakehouse.churn.domain.SourceName;
import com.lakehouse.churn.feature.JoinReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 단계별 처리 건수 메트릭
 * <p>
 * Micrometer 카운터로 누적하고, micro-batch 마다 요약 로그를 한 줄 남깁니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineMetrics {

    public static final String INGEST_RECORDS = "churn.pipeline.ingest.records";
    public static final String CLEAN_RECORDS = "churn.pipeline.clean.records";
    public static final String CLEAN_VIOLATIONS = "churn.pipeline.clean.violations";
    public static final String JOIN_GAPS = "churn.pipeline.join.gaps";
    public static final String SCORED_RECORDS = "churn.pipeline.scoring.records";

    private final MeterRegistry meterRegistry;

    public void recordIngestion(SourceName source, String fileName, int read, long malformed) {
        increment(INGEST_RECORDS, read, "source", source.id(), "outcome", "read");
        increment(INGEST_RECORDS, malformed, "source", source.id(), "outcome", "malformed");
        log.info("[{}] {}: read={}, malformed={}", source.ingestStage(), fileName, read, malformed);
    }

    public void recordCleaning(CleaningReport report) {
        String source = report.source().id();
        increment(CLEAN_RECORDS, report.seen(), "source", source, "outcome", "seen");
        increment(CLEAN_RECORDS, report.malformed(), "source", source, "outcome", "malformed");
        increment(CLEAN_RECORDS, report.dropped(), "source", source, "outcome", "dropped");
        increment(CLEAN_RECORDS, report.written(), "source", source, "outcome", "written");
        report.violations().forEach((expectation, count) ->
                increment(CLEAN_VIOLATIONS, count, "source", source, "expectation", expectation));
        log.info("[{}] seen={}, malformed={}, dropped={}, written={}, violations={}",
                report.source().cleanStage(), report.seen(), report.malformed(), report.dropped(),
                report.written(), report.violations());
    }

    public void recordJoin(JoinReport report) {
        increment(JOIN_GAPS, report.usersWithoutOrders(), "gap", "user_without_orders");
        increment(JOIN_GAPS, report.usersWithoutEvents(), "gap", "user_without_events");
        increment(JOIN_GAPS, report.orderKeysWithoutUser(), "gap", "orders_without_user");
        increment(JOIN_GAPS, report.eventKeysWithoutUser(), "gap", "events_without_user");
        if (report.excludedUsers() > 0 || report.orderKeysWithoutUser() > 0 || report.eventKeysWithoutUser() > 0) {
            log.warn("[features] join excluded {} users (no orders={}, no events={}); orphan keys orders={}, events={}",
                    report.excludedUsers(), report.usersWithoutOrders(), report.usersWithoutEvents(),
                    report.orderKeysWithoutUser(), report.eventKeysWithoutUser());
        }
    }

    public void recordScoring(ScoredRecord record) {
        increment(SCORED_RECORDS, 1, "model", record.modelName(),
                "outcome", record.scoringFailed() ? "failed" : "scored");
    }

    /**
     * 누적값 조회. 아직 기록되지 않은 카운터는 0
     */
    public double count(String name, String... tags) {
        Counter counter = meterRegistry.find(name).tags(tags).counter();
        return counter == null ? 0 : counter.count();
    }

    private void increment(String name, double amount, String... tags) {
        meterRegistry.counter(name, tags).increment(amount);
    }
}
