package com.lakehouse.churn.scoring;

import java.util.List;
import java.util.Map;

/**
 * 외부에서 제공되는 이탈 예측 함수
 * <p>
 * 파이프라인은 inputSchema 에 선언된 컬럼만 담아 호출하며, 모델 로딩 / 버전 선택은 구현체의 몫입니다.
 * 일시적인 접근 실패는 TransientScoringException 으로 알리면 재시도됩니다.
 */
public interface ChurnScorer {

    ModelReference model();

    List<String> inputSchema();

    /**
     * @return 예측 라벨. 예측할 수 없으면 null
     */
    Integer score(Map<String, Object> input);
}
