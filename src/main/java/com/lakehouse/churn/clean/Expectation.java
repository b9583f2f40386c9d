package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.CleanRecord;

/**
 * 정제된 레코드에 대한 row 단위 품질 조건과 위반 시 처리 방식
 * <p>
 * 조건들은 서로 독립적이므로 평가 순서는 결과에 영향을 주지 않습니다.
 */
public record Expectation(String name, String column, Check check, ViolationPolicy policy) {

    public enum Check {
        NOT_NULL,
        NON_NEGATIVE
    }

    public Expectation {
        if (name == null || column == null || check == null || policy == null) {
            throw new IllegalArgumentException("Expectation requires name, column, check and policy");
        }
    }

    public static Expectation notNull(String name, String column, ViolationPolicy policy) {
        return new Expectation(name, column, Check.NOT_NULL, policy);
    }

    public boolean isMetBy(CleanRecord record) {
        Object value = record.column(column);
        return switch (check) {
            case NOT_NULL -> value != null;
            // null 은 NOT_NULL 로 별도 검사
            case NON_NEGATIVE -> value == null || toDouble(value) >= 0;
        };
    }

    private double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalStateException("Expectation " + name + " requires a numeric column, but "
                + column + " is " + value.getClass().getSimpleName());
    }
}
