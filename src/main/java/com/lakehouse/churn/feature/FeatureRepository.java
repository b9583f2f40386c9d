package com.lakehouse.churn.feature;

import com.lakehouse.churn.clean.SilverRecordRepository;
import com.lakehouse.churn.domain.FeatureRecord;
import com.lakehouse.churn.domain.UserRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * churn_features (gold) 테이블 접근. 집계 단계가 매 실행마다 전체를 교체합니다.
 */
@Repository
@RequiredArgsConstructor
public class FeatureRepository {

    public static final RowMapper<FeatureRecord> ROW_MAPPER = (rs, rowNum) -> {
        UserRecord user = SilverRecordRepository.USER_ROW_MAPPER.mapRow(rs, rowNum);
        return new FeatureRecord(
                user,
                rs.getLong("order_count"),
                rs.getObject("total_amount", Long.class),
                rs.getObject("total_item", Long.class),
                rs.getObject("last_transaction", LocalDateTime.class),
                rs.getString("platform"),
                rs.getLong("event_count"),
                rs.getLong("session_count"),
                rs.getObject("last_event", LocalDateTime.class),
                rs.getObject("days_since_creation", Long.class),
                rs.getObject("days_since_last_activity", Long.class),
                rs.getObject("days_last_event", Long.class));
    };

    /** churn_features 컬럼 순서. churn_prediction 도 같은 순서로 피처를 보관합니다. */
    public static final String COLUMN_LIST = """
            user_id, email, creation_date, last_activity_date, firstname, lastname,
            address, canal, country, gender, age_group, churn,
            order_count, total_amount, total_item, last_transaction,
            platform, event_count, session_count, last_event,
            days_since_creation, days_since_last_activity, days_last_event""";

    private final JdbcTemplate jdbcTemplate;

    public void replaceAll(List<FeatureRecord> features) {
        jdbcTemplate.update("DELETE FROM churn_features");
        if (features.isEmpty()) {
            return;
        }
        jdbcTemplate.batchUpdate("INSERT INTO churn_features (" + COLUMN_LIST + ") "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                features.stream().map(FeatureRepository::toRow).toList());
    }

    public static Object[] toRow(FeatureRecord f) {
        UserRecord u = f.user();
        return new Object[]{
                u.userId(), u.email(), u.creationDate(), u.lastActivityDate(), u.firstname(), u.lastname(),
                u.address(), u.canal(), u.country(), u.gender(), u.ageGroup(), u.churn(),
                f.orderCount(), f.totalAmount(), f.totalItem(), f.lastTransaction(),
                f.platform(), f.eventCount(), f.sessionCount(), f.lastEvent(),
                f.daysSinceCreation(), f.daysSinceLastActivity(), f.daysLastEvent()
        };
    }

    public List<FeatureRecord> findAll() {
        return jdbcTemplate.query("SELECT * FROM churn_features ORDER BY user_id", ROW_MAPPER);
    }
}
