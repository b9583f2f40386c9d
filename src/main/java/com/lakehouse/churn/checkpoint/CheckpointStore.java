package com.lakehouse.churn.checkpoint;

import java.util.Set;

/**
 * 단계별 처리 진행 위치 저장소
 *
 * 적재 단계는 처리한 파일 목록을, 정제 단계는 마지막으로 처리한 raw_record id 를 저장합니다.
 * 한 단계(stage)의 체크포인트는 그 단계만 읽고 씁니다.
 */
public interface CheckpointStore {

    Set<String> processedFiles(String stage);

    void markFileProcessed(String stage, String fileName, int recordCount);

    /**
     * @return 마지막으로 커밋된 위치, 없으면 0
     */
    long offset(String stage);

    /**
     * 위치는 앞으로만 이동합니다. 현재보다 작거나 같은 값은 무시됩니다.
     */
    void commitOffset(String stage, long offset);
}
