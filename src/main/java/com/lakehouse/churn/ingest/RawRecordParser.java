package com.lakehouse.churn.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lakehouse.churn.config.PipelineProperties;
import com.lakehouse.churn.domain.RawRecord;
import com.lakehouse.churn.domain.SourceName;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 원천 파일 하나를 RawRecord 목록으로 변환합니다.
 * <p>
 * 한 줄의 파싱 실패는 malformed 레코드로 표시될 뿐 파일 전체를 실패시키지 않습니다.
 * IOException 은 저장소 접근 실패로 보고 호출 측에서 재시도합니다.
 */
public interface RawRecordParser {

    List<RawRecord> parse(Path file) throws IOException;

    static RawRecordParser forSource(SourceName source, PipelineProperties.Source config,
                                     ObjectMapper objectMapper) {
        SourceSchema schema = SourceSchema.of(config.getColumns());
        return switch (config.getFormat()) {
            case CSV -> new CsvRawRecordParser(source, schema, config.getDelimiter(), objectMapper);
            case JSON -> new JsonLinesRawRecordParser(source, schema, objectMapper);
        };
    }
}
