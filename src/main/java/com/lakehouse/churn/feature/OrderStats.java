package com.lakehouse.churn.feature;

import com.lakehouse.churn.domain.OrderRecord;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 사용자별 주문 집계: count(*), sum(amount), sum(item_count), max(creation_date)
 * <p>
 * add / merge 모두 교환 / 결합 법칙을 만족하므로 입력 순서와 무관하게 같은 결과를 냅니다.
 * SQL 과 동일하게 null 은 합계 / 최대값에서 무시되며, 값이 하나도 없으면 합계는 null 입니다.
 */
@Getter
public final class OrderStats {

    private long orderCount;
    private Long totalAmount;
    private Long totalItem;
    private LocalDateTime lastTransaction;

    public OrderStats add(OrderRecord order) {
        orderCount++;
        totalAmount = Aggregates.sum(totalAmount, order.amount());
        totalItem = Aggregates.sum(totalItem, order.itemCount());
        lastTransaction = Aggregates.max(lastTransaction, order.creationDate());
        return this;
    }

    public OrderStats merge(OrderStats other) {
        orderCount += other.orderCount;
        totalAmount = Aggregates.sum(totalAmount, other.totalAmount);
        totalItem = Aggregates.sum(totalItem, other.totalItem);
        lastTransaction = Aggregates.max(lastTransaction, other.lastTransaction);
        return this;
    }
}
