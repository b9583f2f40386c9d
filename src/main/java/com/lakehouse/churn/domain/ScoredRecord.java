package com.lakehouse.churn.domain;

/**
 * churn_prediction 테이블 매핑용 레코드
 *
 * 모델 호출이 실패하거나 시간 초과되면 churnPrediction 은 null, scoringFailed 는 true 입니다.
 */
public record ScoredRecord(
        FeatureRecord features,
        Integer churnPrediction,
        boolean scoringFailed,
        String failureReason,
        String modelName,
        String modelVersion
) {

    public static ScoredRecord scored(FeatureRecord features, Integer prediction,
                                      String modelName, String modelVersion) {
        return new ScoredRecord(features, prediction, false, null, modelName, modelVersion);
    }

    public static ScoredRecord failed(FeatureRecord features, String reason,
                                      String modelName, String modelVersion) {
        return new ScoredRecord(features, null, true, reason, modelName, modelVersion);
    }

    public String userId() {
        return features.userId();
    }
}
