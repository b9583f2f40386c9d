package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.CleanRecord;
import com.lakehouse.churn.domain.EventRecord;
import com.lakehouse.churn.domain.OrderRecord;
import com.lakehouse.churn.domain.UserRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * silver 테이블(churn_users, churn_orders, churn_app_events) 접근
 * <p>
 * 쓰기는 멱등입니다. 사용자는 마지막 프로필이 이기고, 주문 / 이벤트는 먼저 저장된 것이 유지됩니다.
 * 재처리된 micro-batch 가 집계를 두 번 세지 않도록 하기 위함입니다.
 */
@Repository
public class SilverRecordRepository {

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public SilverRecordRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    public void saveUsers(List<UserRecord> users) {
        Map<String, UserRecord> latest = latestByKey(users);
        if (latest.isEmpty()) {
            return;
        }
        jdbcTemplate.batchUpdate("DELETE FROM churn_users WHERE user_id = ?",
                latest.keySet().stream().map(key -> new Object[]{key}).toList());
        jdbcTemplate.batchUpdate("""
                INSERT INTO churn_users (user_id, email, creation_date, last_activity_date, firstname, lastname,
                                         address, canal, country, gender, age_group, churn)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """, latest.values().stream().map(u -> new Object[]{
                u.userId(), u.email(), u.creationDate(), u.lastActivityDate(), u.firstname(), u.lastname(),
                u.address(), u.canal(), u.country(), u.gender(), u.ageGroup(), u.churn()
        }).toList());
    }

    public void saveOrders(List<OrderRecord> orders) {
        insertMissing("churn_orders", "order_id", orders, """
                INSERT INTO churn_orders (order_id, user_id, amount, item_count, creation_date)
                VALUES (?, ?, ?, ?, ?)
                """, o -> new Object[]{o.orderId(), o.userId(), o.amount(), o.itemCount(), o.creationDate()});
    }

    public void saveEvents(List<EventRecord> events) {
        insertMissing("churn_app_events", "event_key", events, """
                INSERT INTO churn_app_events (event_key, user_id, event_id, session_id, platform, event_date,
                                              action, url)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """, e -> new Object[]{e.eventKey(), e.userId(), e.eventId(), e.sessionId(), e.platform(),
                e.eventDate(), e.action(), e.url()});
    }

    public List<UserRecord> findAllUsers() {
        return jdbcTemplate.query("SELECT * FROM churn_users ORDER BY user_id", USER_ROW_MAPPER);
    }

    public List<OrderRecord> findAllOrders() {
        return jdbcTemplate.query("SELECT * FROM churn_orders ORDER BY order_id", (rs, rowNum) -> new OrderRecord(
                rs.getString("order_id"),
                rs.getString("user_id"),
                rs.getObject("amount", Integer.class),
                rs.getObject("item_count", Integer.class),
                rs.getObject("creation_date", LocalDateTime.class)));
    }

    public List<EventRecord> findAllEvents() {
        return jdbcTemplate.query("SELECT * FROM churn_app_events ORDER BY event_key", (rs, rowNum) -> new EventRecord(
                rs.getString("event_key"),
                rs.getString("user_id"),
                rs.getString("event_id"),
                rs.getString("session_id"),
                rs.getString("platform"),
                rs.getObject("event_date", LocalDateTime.class),
                rs.getString("action"),
                rs.getString("url")));
    }

    public static final RowMapper<UserRecord> USER_ROW_MAPPER = (rs, rowNum) -> new UserRecord(
            rs.getString("user_id"),
            rs.getString("email"),
            rs.getObject("creation_date", LocalDateTime.class),
            rs.getObject("last_activity_date", LocalDateTime.class),
            rs.getString("firstname"),
            rs.getString("lastname"),
            rs.getString("address"),
            rs.getString("canal"),
            rs.getString("country"),
            rs.getObject("gender", Integer.class),
            rs.getObject("age_group", Integer.class),
            rs.getObject("churn", Integer.class));

    private <T extends CleanRecord> void insertMissing(String table, String keyColumn, List<T> records,
                                                       String insertSql, Function<T, Object[]> toRow) {
        Map<String, T> firstByKey = new LinkedHashMap<>();
        records.forEach(record -> firstByKey.putIfAbsent(record.key(), record));
        if (firstByKey.isEmpty()) {
            return;
        }

        Set<String> existing = new HashSet<>(namedJdbcTemplate.queryForList(
                "SELECT " + keyColumn + " FROM " + table + " WHERE " + keyColumn + " IN (:keys)",
                new MapSqlParameterSource("keys", firstByKey.keySet()), String.class));

        List<Object[]> rows = firstByKey.values().stream()
                .filter(record -> !existing.contains(record.key()))
                .map(toRow)
                .toList();
        if (!rows.isEmpty()) {
            jdbcTemplate.batchUpdate(insertSql, rows);
        }
    }

    private static Map<String, UserRecord> latestByKey(List<UserRecord> users) {
        Map<String, UserRecord> latest = new LinkedHashMap<>();
        users.forEach(user -> latest.put(user.userId(), user));
        return latest;
    }
}
