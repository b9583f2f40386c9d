package com.lakehouse.churn.ingest;

/**
 * 재시도를 모두 소진한 저장소 접근 실패
 */
public class StorageAccessException extends RuntimeException {

    public StorageAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
