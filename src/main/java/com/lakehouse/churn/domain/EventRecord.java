package com.lakehouse.churn.domain;

import java.time.LocalDateTime;

/**
 * churn_app_events 테이블 매핑용 레코드
 *
 * 이벤트에는 신뢰할 수 있는 자연키가 없어서 원천 위치(파일명:줄번호)를 키로 사용합니다.
 */
public record EventRecord(
        String eventKey,
        String userId,
        String eventId,
        String sessionId,
        String platform,
        LocalDateTime eventDate,
        String action,
        String url
) implements CleanRecord {

    @Override
    public String key() {
        return eventKey;
    }

    @Override
    public Object column(String name) {
        return switch (name) {
            case "event_key" -> eventKey;
            case "user_id" -> userId;
            case "event_id" -> eventId;
            case "session_id" -> sessionId;
            case "platform" -> platform;
            case "date" -> eventDate;
            case "action" -> action;
            case "url" -> url;
            default -> throw new IllegalArgumentException("Unknown events column: " + name);
        };
    }
}
