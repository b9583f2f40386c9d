package com.lakehouse.churn.scoring;

import com.lakehouse.churn.domain.FeatureRecord;
import com.lakehouse.churn.domain.ScoredRecord;
import com.lakehouse.churn.feature.FeatureRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * churn_prediction 테이블 접근. user_id 기준 upsert 입니다.
 */
@Repository
@RequiredArgsConstructor
public class PredictionRepository {

    private static final RowMapper<ScoredRecord> ROW_MAPPER = (rs, rowNum) -> {
        FeatureRecord features = FeatureRepository.ROW_MAPPER.mapRow(rs, rowNum);
        return new ScoredRecord(
                features,
                rs.getObject("churn_prediction", Integer.class),
                rs.getBoolean("scoring_failed"),
                rs.getString("failure_reason"),
                rs.getString("model_name"),
                rs.getString("model_version"));
    };

    private final JdbcTemplate jdbcTemplate;

    public void saveAll(List<? extends ScoredRecord> records) {
        Map<String, ScoredRecord> latest = new LinkedHashMap<>();
        records.forEach(record -> latest.put(record.userId(), record));
        if (latest.isEmpty()) {
            return;
        }

        jdbcTemplate.batchUpdate("DELETE FROM churn_prediction WHERE user_id = ?",
                latest.keySet().stream().map(key -> new Object[]{key}).toList());
        jdbcTemplate.batchUpdate("INSERT INTO churn_prediction (" + FeatureRepository.COLUMN_LIST + """
                        , churn_prediction, scoring_failed, failure_reason, model_name, model_version)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                latest.values().stream().map(PredictionRepository::toRow).toList());
    }

    public List<ScoredRecord> findAll() {
        return jdbcTemplate.query("SELECT * FROM churn_prediction ORDER BY user_id", ROW_MAPPER);
    }

    private static Object[] toRow(ScoredRecord record) {
        return Stream.concat(
                Stream.of(FeatureRepository.toRow(record.features())),
                Stream.of(record.churnPrediction(), record.scoringFailed(), record.failureReason(),
                        record.modelName(), record.modelVersion())
        ).toArray();
    }
}
