package com.lakehouse.churn.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lakehouse.churn.checkpoint.CheckpointStore;
import com.lakehouse.churn.clean.CleanRecordWriter;
import com.lakehouse.churn.clean.CleanedRow;
import com.lakehouse.churn.clean.CleaningProcessor;
import com.lakehouse.churn.clean.EventCleaner;
import com.lakehouse.churn.clean.OrderCleaner;
import com.lakehouse.churn.clean.RecordCleaner;
import com.lakehouse.churn.clean.SilverRecordRepository;
import com.lakehouse.churn.clean.SilverTable;
import com.lakehouse.churn.clean.UserCleaner;
import com.lakehouse.churn.domain.CleanRecord;
import com.lakehouse.churn.domain.RawRecord;
import com.lakehouse.churn.domain.SourceName;
import com.lakehouse.churn.ingest.IngestionTasklet;
import com.lakehouse.churn.ingest.RawRecordParser;
import com.lakehouse.churn.ingest.RawRecordRepository;
import com.lakehouse.churn.ingest.SourceFileStorage;
import com.lakehouse.churn.metrics.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.job.builder.FlowBuilder;
import org.springframework.batch.core.job.flow.Flow;
import org.springframework.batch.core.job.flow.support.SimpleFlow;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.database.JdbcCursorItemReader;
import org.springframework.batch.infrastructure.item.database.builder.JdbcCursorItemReaderBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * 원천별 적재 / 정제 Flow 설정
 * <p>
 * 원천마다 ingest.&lt;source&gt; (Tasklet) → clean.&lt;source&gt; (Chunk) 순서의 Flow 를 만들고,
 * 세 Flow 를 split 으로 병렬 실행합니다. split 이 끝나야 다음 단계(features)가 시작됩니다.
 * <p>
 * 각 원천은 자신의 테이블과 체크포인트에만 쓰기 때문에 병렬 실행 시 서로 간섭하지 않습니다.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class SourcePipelineConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final TransactionTemplate transactionTemplate;
    private final DataSource dataSource;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final SourceFileStorage storage;
    private final RawRecordRepository rawRecordRepository;
    private final SilverRecordRepository silverRecordRepository;
    private final CheckpointStore checkpointStore;
    private final PipelineMetrics metrics;

    @Bean
    public TaskExecutor sourceTaskExecutor() {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("source-");
        executor.setConcurrencyLimit(SourceName.values().length);
        return executor;
    }

    @Bean
    public Flow sourceSplitFlow(TaskExecutor sourceTaskExecutor) {
        return new FlowBuilder<SimpleFlow>("sourceSplitFlow")
                .split(sourceTaskExecutor)
                .add(usersFlow(), ordersFlow(), eventsFlow())
                .build();
    }

    private Flow usersFlow() {
        String pattern = properties.source(SourceName.USERS).getTimestampFormat();
        return sourceFlow(SourceName.USERS, new UserCleaner(pattern), silverRecordRepository::saveUsers);
    }

    private Flow ordersFlow() {
        String pattern = properties.source(SourceName.ORDERS).getTimestampFormat();
        return sourceFlow(SourceName.ORDERS, new OrderCleaner(pattern), silverRecordRepository::saveOrders);
    }

    private Flow eventsFlow() {
        String pattern = properties.source(SourceName.EVENTS).getTimestampFormat();
        return sourceFlow(SourceName.EVENTS, new EventCleaner(pattern), silverRecordRepository::saveEvents);
    }

    private <T extends CleanRecord> Flow sourceFlow(SourceName source, RecordCleaner<T> cleaner,
                                                    SilverTable<T> table) {
        return new FlowBuilder<SimpleFlow>(source.id() + "Flow")
                .start(ingestStep(source))
                .next(cleanStep(source, cleaner, table))
                .build();
    }

    private Step ingestStep(SourceName source) {
        PipelineProperties.Source config = properties.source(source);
        IngestionTasklet tasklet = new IngestionTasklet(
                source,
                config.getDirectory(),
                RawRecordParser.forSource(source, config, objectMapper),
                storage,
                rawRecordRepository,
                checkpointStore,
                metrics);

        return new StepBuilder(source.ingestStage(), jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

    private <T extends CleanRecord> Step cleanStep(SourceName source, RecordCleaner<T> cleaner,
                                                   SilverTable<T> table) {
        CleaningProcessor<T> processor =
                new CleaningProcessor<>(source, cleaner, properties.source(source).toExpectations());
        CleanRecordWriter<T> writer =
                new CleanRecordWriter<>(source, table, checkpointStore, transactionTemplate, metrics);

        return new StepBuilder(source.cleanStage(), jobRepository)
                .<RawRecord, CleanedRow<T>>chunk(properties.getChunkSize())
                .reader(rawRecordReader(source))
                .processor(processor)
                .writer(writer)
                .build();
    }

    /**
     * 체크포인트 이후의 raw_record 를 id 순으로 읽는 Reader
     * <p>
     * 오프셋은 Reader 가 열리는 시점(= 정제 단계 시작)에 조회합니다.
     * 재시작 위치는 Batch 의 ExecutionContext 가 아니라 stage_offset 이 결정하므로 saveState 는 끕니다.
     */
    private JdbcCursorItemReader<RawRecord> rawRecordReader(SourceName source) {
        String sql = """
                SELECT id, source, file_name, line_no, payload, malformed, rescued_data
                FROM raw_record
                WHERE source = ? AND id > ?
                ORDER BY id
                """;

        return new JdbcCursorItemReaderBuilder<RawRecord>()
                .name(source.id() + "RawRecordReader")
                .dataSource(dataSource)
                .sql(sql)
                .preparedStatementSetter(ps -> {
                    long offset = checkpointStore.offset(source.cleanStage());
                    log.info("[{}] reading raw records after id {}", source.cleanStage(), offset);
                    ps.setString(1, source.name());
                    ps.setLong(2, offset);
                })
                .rowMapper(rawRecordRepository.rowMapper())
                .saveState(false)
                .build();
    }
}
