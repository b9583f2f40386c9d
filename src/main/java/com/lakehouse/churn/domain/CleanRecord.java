package com.lakehouse.churn.domain;

/**
 * 정제 단계가 만들어내는 타입이 지정된 레코드 (silver)
 *
 * Expectation 은 컬럼 이름으로 값을 조회하므로 각 레코드는 이름 기반 조회를 제공합니다.
 */
public interface CleanRecord {

    /**
     * silver 테이블의 기본키
     */
    String key();

    /**
     * @throws IllegalArgumentException 알 수 없는 컬럼
     */
    Object column(String name);
}
