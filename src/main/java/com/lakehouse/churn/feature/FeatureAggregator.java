package com.lakehouse.churn.feature;

import com.lakehouse.churn.domain.EventRecord;
import com.lakehouse.churn.domain.FeatureRecord;
import com.lakehouse.churn.domain.OrderRecord;
import com.lakehouse.churn.domain.UserRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 사용자 단위 피처 집계
 * <p>
 * 주문 / 이벤트를 user_id 로 그룹핑해 집계한 뒤 사용자와 inner join 합니다.
 * 세 원천 모두에 존재하는 user_id 만 결과에 포함됩니다.
 * 매 실행마다 전체 이력을 다시 계산하며, 결과는 user_id 순으로 정렬됩니다.
 */
@Component
public class FeatureAggregator {

    public FeatureResult aggregate(Collection<UserRecord> users,
                                   Collection<OrderRecord> orders,
                                   Collection<EventRecord> events,
                                   LocalDateTime evaluationInstant) {
        Objects.requireNonNull(evaluationInstant, "evaluationInstant");

        Map<String, OrderStats> orderStats = new HashMap<>();
        for (OrderRecord order : orders) {
            if (order.userId() != null) {
                orderStats.computeIfAbsent(order.userId(), key -> new OrderStats()).add(order);
            }
        }
        Map<String, EventStats> eventStats = new HashMap<>();
        for (EventRecord event : events) {
            if (event.userId() != null) {
                eventStats.computeIfAbsent(event.userId(), key -> new EventStats()).add(event);
            }
        }

        List<UserRecord> sortedUsers = users.stream()
                .filter(user -> user.userId() != null)
                .sorted(Comparator.comparing(UserRecord::userId))
                .toList();

        List<FeatureRecord> features = new ArrayList<>();
        int withoutOrders = 0;
        int withoutEvents = 0;
        int excluded = 0;
        for (UserRecord user : sortedUsers) {
            OrderStats o = orderStats.get(user.userId());
            EventStats e = eventStats.get(user.userId());
            if (o == null) {
                withoutOrders++;
            }
            if (e == null) {
                withoutEvents++;
            }
            if (o == null || e == null) {
                excluded++;
                continue;
            }
            features.add(toFeature(user, o, e, evaluationInstant));
        }

        Set<String> userIds = sortedUsers.stream().map(UserRecord::userId).collect(Collectors.toSet());
        int orphanOrderKeys = (int) orderStats.keySet().stream().filter(key -> !userIds.contains(key)).count();
        int orphanEventKeys = (int) eventStats.keySet().stream().filter(key -> !userIds.contains(key)).count();

        JoinReport report = new JoinReport(features.size(), excluded, withoutOrders, withoutEvents,
                orphanOrderKeys, orphanEventKeys);
        return new FeatureResult(List.copyOf(features), report);
    }

    private static FeatureRecord toFeature(UserRecord user, OrderStats orders, EventStats events,
                                           LocalDateTime evaluationInstant) {
        return new FeatureRecord(
                user,
                orders.getOrderCount(),
                orders.getTotalAmount(),
                orders.getTotalItem(),
                orders.getLastTransaction(),
                events.getPlatform(),
                events.getEventCount(),
                events.getSessionCount(),
                events.getLastEvent(),
                Aggregates.daysBetween(user.creationDate(), evaluationInstant),
                Aggregates.daysBetween(user.lastActivityDate(), evaluationInstant),
                Aggregates.daysBetween(events.getLastEvent(), evaluationInstant));
    }
}
