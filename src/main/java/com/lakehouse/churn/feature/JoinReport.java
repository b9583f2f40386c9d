package com.lakehouse.churn.feature;

/**
 * inner join 으로 제외된 키 현황
 * <p>
 * 오류는 아니지만 조용한 데이터 유실을 드러내기 위해 메트릭으로 기록합니다.
 * 주문도 이벤트도 없는 사용자는 usersWithoutOrders, usersWithoutEvents 양쪽에 모두 포함됩니다.
 */
public record JoinReport(
        int joined,
        int excludedUsers,
        int usersWithoutOrders,
        int usersWithoutEvents,
        int orderKeysWithoutUser,
        int eventKeysWithoutUser
) {
}
