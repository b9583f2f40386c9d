package com.lakehouse.churn.scoring;

import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 모델 서빙 엔드포인트가 설정되지 않았을 때 쓰는 기준 스코어러
 * <p>
 * 마지막 이벤트 이후 경과일이 임계값을 넘으면 이탈(1)로 예측합니다.
 */
@RequiredArgsConstructor
public class InactivityChurnScorer implements ChurnScorer {

    private final ModelReference model;
    private final List<String> inputSchema;
    private final long thresholdDays;

    @Override
    public ModelReference model() {
        return model;
    }

    @Override
    public List<String> inputSchema() {
        return inputSchema;
    }

    @Override
    public Integer score(Map<String, Object> input) {
        Object daysLastEvent = input.get("days_last_event");
        if (!(daysLastEvent instanceof Number days)) {
            return null;
        }
        return days.longValue() > thresholdDays ? 1 : 0;
    }
}
