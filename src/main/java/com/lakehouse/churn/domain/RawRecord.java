package com.lakehouse.churn.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 원천 파일 한 줄을 파싱한 결과 (bronze)
 *
 * 스키마에 맞지 않는 줄은 버리지 않고 malformed 로 표시한 채 다음 단계로 넘깁니다.
 * rescuedData 에는 파싱하지 못한 원문 또는 선언되지 않은 컬럼이 JSON 으로 남습니다.
 */
public record RawRecord(
        Long id,
        SourceName source,
        String fileName,
        int lineNumber,
        Map<String, Object> fields,
        boolean malformed,
        String rescuedData
) {

    public RawRecord {
        // null 값을 허용해야 하므로 Map.copyOf 대신 LinkedHashMap 복사본을 사용
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawRecord parsed(SourceName source, String fileName, int lineNumber,
                                   Map<String, Object> fields) {
        return new RawRecord(null, source, fileName, lineNumber, fields, false, null);
    }

    public static RawRecord malformed(SourceName source, String fileName, int lineNumber,
                                      Map<String, Object> fields, String rescuedData) {
        return new RawRecord(null, source, fileName, lineNumber, fields, true, rescuedData);
    }

    public RawRecord withId(long newId) {
        return new RawRecord(newId, source, fileName, lineNumber, fields, malformed, rescuedData);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    /**
     * 파일명:줄번호. 이벤트처럼 자연키가 없는 원천의 중복 제거 키로 쓰입니다.
     */
    public String origin() {
        return fileName + ":" + lineNumber;
    }
}
