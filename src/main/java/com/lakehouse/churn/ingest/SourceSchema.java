package com.lakehouse.churn.ingest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 원천별 선언 스키마
 * <p>
 * 선언된 컬럼이 없으면 추론 모드로 동작하여 모든 컬럼을 받아들입니다.
 * 선언된 스키마에 없는 컬럼은 rescued 로 분리되고 해당 레코드는 malformed 가 됩니다.
 */
public final class SourceSchema {

    private final Set<String> declared;

    private SourceSchema(Set<String> declared) {
        this.declared = declared;
    }

    public static SourceSchema of(List<String> columns) {
        return new SourceSchema(columns == null ? Set.of() : Set.copyOf(columns));
    }

    public static SourceSchema inferred() {
        return new SourceSchema(Set.of());
    }

    public boolean isInferred() {
        return declared.isEmpty();
    }

    /**
     * @return 선언되지 않은 컬럼들. 없으면 빈 Map
     */
    public Map<String, Object> rescued(Map<String, Object> fields) {
        Map<String, Object> rescued = new LinkedHashMap<>();
        if (isInferred()) {
            return rescued;
        }
        fields.forEach((name, value) -> {
            if (!declared.contains(name)) {
                rescued.put(name, value);
            }
        });
        return rescued;
    }

    public Map<String, Object> conforming(Map<String, Object> fields) {
        if (isInferred()) {
            return fields;
        }
        Map<String, Object> kept = new LinkedHashMap<>();
        fields.forEach((name, value) -> {
            if (declared.contains(name)) {
                kept.put(name, value);
            }
        });
        return kept;
    }
}
