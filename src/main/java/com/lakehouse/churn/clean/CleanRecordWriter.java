package com.lakehouse.churn.clean;

import com.lakehouse.churn.checkpoint.CheckpointStore;
import com.lakehouse.churn.domain.CleanRecord;
import com.lakehouse.churn.domain.SourceName;
import com.lakehouse.churn.metrics.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Objects;

/**
 * 정제 결과를 silver 테이블에 저장하고 같은 트랜잭션에서 체크포인트를 chunk 의 마지막 raw id 로 옮깁니다.
 * <p>
 * 메트릭은 커밋 이후에 기록되므로 롤백된 chunk 는 집계되지 않습니다.
 */
@RequiredArgsConstructor
public class CleanRecordWriter<T extends CleanRecord> implements ItemWriter<CleanedRow<T>> {

    private final SourceName source;
    private final SilverTable<T> table;
    private final CheckpointStore checkpointStore;
    private final TransactionTemplate transactionTemplate;
    private final PipelineMetrics metrics;

    @Override
    public void write(Chunk<? extends CleanedRow<T>> chunk) {
        List<? extends CleanedRow<T>> rows = chunk.getItems();
        List<T> kept = rows.stream()
                .filter(CleanedRow::isKept)
                .map(CleanedRow::record)
                .toList();
        long lastRawId = rows.stream()
                .map(CleanedRow::rawId)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .max()
                .orElse(0L);

        transactionTemplate.executeWithoutResult(status -> {
            if (!kept.isEmpty()) {
                table.saveAll(kept);
            }
            checkpointStore.commitOffset(source.cleanStage(), lastRawId);
        });

        metrics.recordCleaning(CleaningReport.of(source, rows));
    }
}
