package com.lakehouse.churn.domain;

import java.time.LocalDateTime;

/**
 * churn_orders 테이블 매핑용 레코드
 */
public record OrderRecord(
        String orderId,
        String userId,
        Integer amount,
        Integer itemCount,
        LocalDateTime creationDate
) implements CleanRecord {

    @Override
    public String key() {
        return orderId;
    }

    @Override
    public Object column(String name) {
        return switch (name) {
            case "order_id" -> orderId;
            case "user_id" -> userId;
            case "amount" -> amount;
            case "item_count" -> itemCount;
            case "creation_date" -> creationDate;
            default -> throw new IllegalArgumentException("Unknown orders column: " + name);
        };
    }
}
