package com.lakehouse.churn.ingest;

import com.lakehouse.churn.checkpoint.CheckpointStore;
import com.lakehouse.churn.domain.RawRecord;
import com.lakehouse.churn.domain.SourceName;
import com.lakehouse.churn.metrics.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.nio.file.Path;
import java.util.List;

/**
 * 원천 하나의 증분 적재 Tasklet
 * <p>
 * 한 번의 execute 호출이 파일 하나(= micro-batch 하나)를 처리합니다.
 * raw_record 저장과 파일 체크포인트가 같은 트랜잭션으로 커밋되므로 재시작 시 같은 파일을 다시 읽지 않습니다.
 * 남은 파일이 있으면 CONTINUABLE, 없으면 FINISHED 를 반환합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class IngestionTasklet implements Tasklet {

    public static final String INPUT_ROOT = "inputRoot";

    private final SourceName source;
    private final String directory;
    private final RawRecordParser parser;
    private final SourceFileStorage storage;
    private final RawRecordRepository rawRecordRepository;
    private final CheckpointStore checkpointStore;
    private final PipelineMetrics metrics;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        String inputRoot = chunkContext.getStepContext().getStepExecution()
                .getJobParameters().getString(INPUT_ROOT);
        if (inputRoot == null || inputRoot.isBlank()) {
            throw new IllegalStateException("Job parameter '" + INPUT_ROOT + "' is required");
        }

        List<Path> pending = storage.discoverNewFiles(source, Path.of(inputRoot).resolve(directory));
        if (pending.isEmpty()) {
            log.info("[{}] no new files", source.ingestStage());
            return RepeatStatus.FINISHED;
        }

        Path file = pending.get(0);
        String fileName = file.getFileName().toString();
        List<RawRecord> records = storage.read(file, parser);
        int inserted = rawRecordRepository.insertMissing(source, fileName, records);
        checkpointStore.markFileProcessed(source.ingestStage(), fileName, records.size());

        long malformed = records.stream().filter(RawRecord::malformed).count();
        metrics.recordIngestion(source, fileName, records.size(), malformed);
        if (inserted < records.size()) {
            log.info("[{}] {} already held {} of {} records", source.ingestStage(), fileName,
                    records.size() - inserted, records.size());
        }

        return pending.size() > 1 ? RepeatStatus.CONTINUABLE : RepeatStatus.FINISHED;
    }
}
