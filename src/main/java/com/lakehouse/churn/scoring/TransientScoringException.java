package com.lakehouse.churn.scoring;

/**
 * 재시도하면 성공할 수 있는 모델 호출 실패 (네트워크 오류, 5xx 등)
 */
public class TransientScoringException extends ScoringException {

    public TransientScoringException(String message) {
        super(message);
    }

    public TransientScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
