package com.lakehouse.churn.domain;

import java.time.LocalDateTime;
import java.util.List;

/**
 * churn_features 테이블 매핑용 레코드 (gold)
 *
 * 사용자 정보에 주문 / 이벤트 집계를 user_id 로 inner join 한 결과입니다.
 * days_* 컬럼은 잡 파라미터로 받은 evaluationInstant 기준으로 계산됩니다.
 */
public record FeatureRecord(
        UserRecord user,
        long orderCount,
        Long totalAmount,
        Long totalItem,
        LocalDateTime lastTransaction,
        String platform,
        long eventCount,
        long sessionCount,
        LocalDateTime lastEvent,
        Long daysSinceCreation,
        Long daysSinceLastActivity,
        Long daysLastEvent
) {

    public static final List<String> COLUMNS = List.of(
            "user_id", "email", "creation_date", "last_activity_date", "firstname", "lastname",
            "address", "canal", "country", "gender", "age_group", "churn",
            "order_count", "total_amount", "total_item", "last_transaction",
            "platform", "event_count", "session_count", "last_event",
            "days_since_creation", "days_since_last_activity", "days_last_event");

    public String userId() {
        return user.userId();
    }

    public Object column(String name) {
        return switch (name) {
            case "order_count" -> orderCount;
            case "total_amount" -> totalAmount;
            case "total_item" -> totalItem;
            case "last_transaction" -> lastTransaction;
            case "platform" -> platform;
            case "event_count" -> eventCount;
            case "session_count" -> sessionCount;
            case "last_event" -> lastEvent;
            case "days_since_creation" -> daysSinceCreation;
            case "days_since_last_activity" -> daysSinceLastActivity;
            case "days_last_event" -> daysLastEvent;
            default -> user.column(name);
        };
    }
}
