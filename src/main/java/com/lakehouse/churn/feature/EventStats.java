package com.lakehouse.churn.feature;

import com.lakehouse.churn.domain.EventRecord;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;

/**
 * 사용자별 이벤트 집계: count(*), count(distinct session_id), 첫 platform, max(date)
 * <p>
 * "첫 platform" 은 입력 순서에 의존하지 않도록 가장 이른 이벤트의 platform 으로 정의합니다.
 * 날짜가 같으면 platform 사전순, 날짜 없는 이벤트는 날짜 있는 이벤트보다 뒤입니다.
 * 세션 수는 정확한 집합으로 계산합니다.
 */
public final class EventStats {

    private static final Comparator<LocalDateTime> NULLS_LAST = Comparator.nullsLast(Comparator.naturalOrder());

    @Getter
    private long eventCount;
    private final Set<String> sessions = new HashSet<>();
    @Getter
    private String platform;
    private LocalDateTime platformSeenAt;
    @Getter
    private LocalDateTime lastEvent;

    public EventStats add(EventRecord event) {
        eventCount++;
        if (event.sessionId() != null) {
            sessions.add(event.sessionId());
        }
        offerPlatform(event.platform(), event.eventDate());
        lastEvent = Aggregates.max(lastEvent, event.eventDate());
        return this;
    }

    public EventStats merge(EventStats other) {
        eventCount += other.eventCount;
        sessions.addAll(other.sessions);
        offerPlatform(other.platform, other.platformSeenAt);
        lastEvent = Aggregates.max(lastEvent, other.lastEvent);
        return this;
    }

    public long getSessionCount() {
        return sessions.size();
    }

    private void offerPlatform(String candidate, LocalDateTime seenAt) {
        if (candidate == null) {
            return;
        }
        if (platform == null) {
            platform = candidate;
            platformSeenAt = seenAt;
            return;
        }
        int byDate = NULLS_LAST.compare(seenAt, platformSeenAt);
        if (byDate < 0 || (byDate == 0 && candidate.compareTo(platform) < 0)) {
            platform = candidate;
            platformSeenAt = seenAt;
        }
    }
}
