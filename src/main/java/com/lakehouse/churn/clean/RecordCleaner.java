package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.CleanRecord;
import com.lakehouse.churn.domain.RawRecord;

/**
 * 원천별 타입 변환 / 정규화. Expectation 검사는 CleaningProcessor 가 담당합니다.
 */
@FunctionalInterface
public interface RecordCleaner<T extends CleanRecord> {

    T clean(RawRecord raw);
}
