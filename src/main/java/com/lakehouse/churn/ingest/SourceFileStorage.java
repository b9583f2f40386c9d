package com.lakehouse.churn.ingest;

import com.lakehouse.churn.checkpoint.CheckpointStore;
import com.lakehouse.churn.domain.RawRecord;
import com.lakehouse.churn.domain.SourceName;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * 원천 디렉터리 접근
 * <p>
 * 체크포인트에 없는 새 파일만 찾아내며, 모든 파일 시스템 접근은 storageRetry 로 재시도합니다.
 * 숨김 파일과 '_' 로 시작하는 파일(_SUCCESS 등)은 무시합니다.
 */
@Slf4j
@Component
public class SourceFileStorage {

    private final CheckpointStore checkpointStore;
    private final Retry storageRetry;

    public SourceFileStorage(CheckpointStore checkpointStore,
                             @Qualifier("storageRetry") Retry storageRetry) {
        this.checkpointStore = checkpointStore;
        this.storageRetry = storageRetry;
    }

    /**
     * @return 아직 적재되지 않은 파일 (파일명 순). 디렉터리가 없으면 빈 목록
     */
    public List<Path> discoverNewFiles(SourceName source, Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("[{}] source directory {} does not exist yet", source.ingestStage(), directory);
            return List.of();
        }
        Set<String> processed = checkpointStore.processedFiles(source.ingestStage());
        List<Path> files = withRetry("list " + directory, () -> listFiles(directory));
        return files.stream()
                .filter(file -> !processed.contains(file.getFileName().toString()))
                .toList();
    }

    public List<RawRecord> read(Path file, RawRecordParser parser) {
        return withRetry("read " + file, () -> parser.parse(file));
    }

    private static List<Path> listFiles(Path directory) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(file -> !isIgnored(file.getFileName().toString()))
                    .sorted(Comparator.comparing(file -> file.getFileName().toString()))
                    .toList();
        }
    }

    private static boolean isIgnored(String fileName) {
        return fileName.startsWith(".") || fileName.startsWith("_");
    }

    private <T> T withRetry(String operation, Callable<T> call) {
        try {
            return storageRetry.executeCallable(call);
        } catch (RuntimeException e) {
            if (e.getCause() instanceof IOException) {
                throw new StorageAccessException("Storage access failed: " + operation, e.getCause());
            }
            throw e;
        } catch (Exception e) {
            throw new StorageAccessException("Storage access failed: " + operation, e);
        }
    }
}
