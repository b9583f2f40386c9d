package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.CleanRecord;

import java.util.List;

/**
 * CleaningProcessor 의 처리 결과
 * <p>
 * 제외된 row 도 Writer 까지 전달되어야 체크포인트(rawId)와 메트릭에 반영됩니다.
 * 그래서 Processor 는 null 로 필터링하지 않고 항상 CleanedRow 를 반환합니다.
 */
public record CleanedRow<T extends CleanRecord>(
        Long rawId,
        T record,
        Outcome outcome,
        List<String> violations
) {

    public enum Outcome {
        KEPT,
        DROPPED,
        MALFORMED
    }

    public CleanedRow {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static <T extends CleanRecord> CleanedRow<T> kept(Long rawId, T record, List<String> alerts) {
        return new CleanedRow<>(rawId, record, Outcome.KEPT, alerts);
    }

    public static <T extends CleanRecord> CleanedRow<T> dropped(Long rawId, List<String> violations) {
        return new CleanedRow<>(rawId, null, Outcome.DROPPED, violations);
    }

    public static <T extends CleanRecord> CleanedRow<T> malformed(Long rawId) {
        return new CleanedRow<>(rawId, null, Outcome.MALFORMED, List.of());
    }

    public boolean isKept() {
        return outcome == Outcome.KEPT;
    }
}
