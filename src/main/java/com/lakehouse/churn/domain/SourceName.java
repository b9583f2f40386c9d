package com.lakehouse.churn.domain;

/**
 * 파이프라인에 들어오는 원천 데이터 구분
 *
 * 각 원천은 자신만의 적재(ingest) / 정제(clean) 단계와 체크포인트를 가집니다.
 */
public enum SourceName {

    USERS("users"),
    ORDERS("orders"),
    EVENTS("events");

    private final String id;

    SourceName(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public String ingestStage() {
        return "ingest." + id;
    }

    public String cleanStage() {
        return "clean." + id;
    }
}
