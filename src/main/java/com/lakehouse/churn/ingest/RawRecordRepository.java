package com.lakehouse.churn.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lakehouse.churn.domain.RawRecord;
import com.lakehouse.churn.domain.SourceName;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * raw_record (bronze) 테이블 접근
 * <p>
 * (source, file_name, line_no) 가 같은 레코드는 한 번만 저장되므로
 * 같은 파일을 다시 적재해도 중복이 생기지 않습니다.
 */
@Repository
@RequiredArgsConstructor
public class RawRecordRepository {

    private static final TypeReference<Map<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * 같은 파일에서 온 레코드 목록을 저장합니다.
     *
     * @return 새로 저장된 건수
     */
    public int insertMissing(SourceName source, String fileName, List<RawRecord> records) {
        Set<Integer> existing = new HashSet<>(jdbcTemplate.queryForList(
                "SELECT line_no FROM raw_record WHERE source = ? AND file_name = ?",
                Integer.class, source.name(), fileName));

        List<Object[]> rows = records.stream()
                .filter(record -> !existing.contains(record.lineNumber()))
                .map(record -> new Object[]{
                        source.name(),
                        fileName,
                        record.lineNumber(),
                        toJson(record.fields()),
                        record.malformed(),
                        record.rescuedData()
                })
                .toList();
        if (rows.isEmpty()) {
            return 0;
        }
        jdbcTemplate.batchUpdate("""
                INSERT INTO raw_record (source, file_name, line_no, payload, malformed, rescued_data)
                VALUES (?, ?, ?, ?, ?, ?)
                """, rows);
        return rows.size();
    }

    public RowMapper<RawRecord> rowMapper() {
        return (rs, rowNum) -> new RawRecord(
                rs.getLong("id"),
                SourceName.valueOf(rs.getString("source")),
                rs.getString("file_name"),
                rs.getInt("line_no"),
                fromJson(rs.getString("payload")),
                rs.getBoolean("malformed"),
                rs.getString("rescued_data"));
    }

    private String toJson(Map<String, Object> fields) {
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize raw fields " + fields.keySet(), e);
        }
    }

    private Map<String, Object> fromJson(String payload) {
        try {
            return objectMapper.readValue(payload, FIELDS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted raw_record payload: " + payload, e);
        }
    }
}
