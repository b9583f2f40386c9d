package com.lakehouse.churn.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

final class RescuedData {

    private RescuedData() {
    }

    static String toJson(ObjectMapper objectMapper, Map<String, Object> rescued) {
        try {
            return objectMapper.writeValueAsString(rescued);
        } catch (JsonProcessingException e) {
            // 스칼라 값만 담긴 Map 이라 발생하지 않아야 함
            throw new IllegalStateException("Cannot serialize rescued columns " + rescued.keySet(), e);
        }
    }
}
