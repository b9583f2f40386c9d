package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.SourceName;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 정제 micro-batch 한 번의 처리 결과
 */
public record CleaningReport(
        SourceName source,
        int seen,
        int malformed,
        int dropped,
        int written,
        Map<String, Long> violations
) {

    public static CleaningReport of(SourceName source, List<? extends CleanedRow<?>> rows) {
        int malformed = 0;
        int dropped = 0;
        int written = 0;
        Map<String, Long> violations = new TreeMap<>();
        for (CleanedRow<?> row : rows) {
            switch (row.outcome()) {
                case MALFORMED -> malformed++;
                case DROPPED -> dropped++;
                case KEPT -> written++;
            }
            row.violations().forEach(name -> violations.merge(name, 1L, Long::sum));
        }
        return new CleaningReport(source, rows.size(), malformed, dropped, written, violations);
    }
}
