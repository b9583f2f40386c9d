package com.lakehouse.churn.clean;

/**
 * Expectation 위반 시 처리 방식
 */
public enum ViolationPolicy {

    /** 해당 row 를 제외하고 계속 진행 */
    DROP_ROW,

    /** micro-batch 전체를 중단 */
    FAIL,

    /** row 는 유지하고 위반 건수만 기록 */
    ALERT
}
