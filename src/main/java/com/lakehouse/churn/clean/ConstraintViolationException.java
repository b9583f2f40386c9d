package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.SourceName;
import lombok.Getter;

import java.util.List;

/**
 * FAIL 정책 Expectation 위반. 현재 micro-batch 를 중단시키며 체크포인트는 전진하지 않습니다.
 */
@Getter
public class ConstraintViolationException extends RuntimeException {

    private final SourceName source;
    private final List<String> expectations;
    private final String origin;

    public ConstraintViolationException(SourceName source, List<String> expectations, String origin) {
        super("Expectation " + expectations + " failed for " + source.id() + " record at " + origin);
        this.source = source;
        this.expectations = List.copyOf(expectations);
        this.origin = origin;
    }
}
