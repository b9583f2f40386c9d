package com.lakehouse.churn.checkpoint;

/**
 * 체크포인트 커밋 실패. 재처리 범위가 모호해지므로 잡 전체를 실패시킵니다.
 */
public class CheckpointCommitException extends RuntimeException {

    public CheckpointCommitException(String stage, Throwable cause) {
        super("Failed to commit checkpoint for stage " + stage, cause);
    }
}
