package com.lakehouse.churn.feature;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

final class Aggregates {

    private Aggregates() {
    }

    static Long sum(Long total, Number value) {
        if (value == null) {
            return total;
        }
        return total == null ? value.longValue() : total + value.longValue();
    }

    static LocalDateTime max(LocalDateTime current, LocalDateTime candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.isAfter(current) ? candidate : current;
    }

    /**
     * datediff(evaluationInstant, timestamp): 날짜 부분끼리의 일수 차이
     */
    static Long daysBetween(LocalDateTime timestamp, LocalDateTime evaluationInstant) {
        if (timestamp == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(timestamp.toLocalDate(), evaluationInstant.toLocalDate());
    }
}
