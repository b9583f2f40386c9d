package com.lakehouse.churn.feature;

import com.lakehouse.churn.domain.FeatureRecord;

import java.util.List;

public record FeatureResult(List<FeatureRecord> features, JoinReport joinReport) {
}
