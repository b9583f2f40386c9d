package com.lakehouse.churn.checkpoint;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * ingested_file / stage_offset 테이블 기반 체크포인트 저장소
 *
 * 호출하는 단계의 트랜잭션에 참여하므로 데이터 적재와 체크포인트가 함께 커밋됩니다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcCheckpointStore implements CheckpointStore {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Override
    public Set<String> processedFiles(String stage) {
        List<String> files = jdbcTemplate.queryForList(
                "SELECT file_name FROM ingested_file WHERE stage = ?", String.class, stage);
        return new HashSet<>(files);
    }

    @Override
    public void markFileProcessed(String stage, String fileName, int recordCount) {
        try {
            jdbcTemplate.update("""
                    INSERT INTO ingested_file (stage, file_name, record_count, ingested_at)
                    VALUES (?, ?, ?, ?)
                    """, stage, fileName, recordCount, LocalDateTime.now(clock));
        } catch (DataAccessException e) {
            throw new CheckpointCommitException(stage, e);
        }
    }

    @Override
    public long offset(String stage) {
        List<Long> offsets = jdbcTemplate.queryForList(
                "SELECT last_raw_id FROM stage_offset WHERE stage = ?", Long.class, stage);
        return offsets.isEmpty() ? 0L : offsets.get(0);
    }

    @Override
    public void commitOffset(String stage, long offset) {
        try {
            long current = offset(stage);
            if (offset <= current) {
                return;
            }
            int updated = jdbcTemplate.update(
                    "UPDATE stage_offset SET last_raw_id = ?, updated_at = ? WHERE stage = ?",
                    offset, LocalDateTime.now(clock), stage);
            if (updated == 0) {
                jdbcTemplate.update(
                        "INSERT INTO stage_offset (stage, last_raw_id, updated_at) VALUES (?, ?, ?)",
                        stage, offset, LocalDateTime.now(clock));
            }
            log.debug("Committed offset {} for stage {}", offset, stage);
        } catch (DataAccessException e) {
            throw new CheckpointCommitException(stage, e);
        }
    }
}
