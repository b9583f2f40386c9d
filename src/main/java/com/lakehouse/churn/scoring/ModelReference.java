package com.lakehouse.churn.scoring;

/**
 * 외부 모델 레지스트리의 모델 이름과 버전(또는 stage)
 */
public record ModelReference(String name, String version) {

    @Override
    public String toString() {
        return "models:/" + name + "/" + version;
    }
}
