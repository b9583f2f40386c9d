package com.lakehouse.churn.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lakehouse.churn.domain.RawRecord;
import com.lakehouse.churn.domain.SourceName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.infrastructure.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.infrastructure.item.file.transform.FieldSet;
import org.springframework.batch.infrastructure.item.file.transform.IncorrectTokenCountException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 헤더가 있는 CSV 파일 파서
 * <p>
 * 첫 줄을 헤더로 읽어 컬럼명을 결정하고, 이후 각 줄을 DelimitedLineTokenizer 로 분리합니다.
 * 컬럼 수가 헤더와 다르면 원문을 rescuedData 에 담아 malformed 로 표시합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class CsvRawRecordParser implements RawRecordParser {

    private static final String BOM = "\uFEFF";

    private final SourceName source;
    private final SourceSchema schema;
    private final String delimiter;
    private final ObjectMapper objectMapper;

    @Override
    public List<RawRecord> parse(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        List<RawRecord> records = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                log.warn("[{}] {} is empty", source.ingestStage(), fileName);
                return records;
            }
            if (headerLine.startsWith(BOM)) {
                headerLine = headerLine.substring(1);
            }
            String[] header = new DelimitedLineTokenizer(delimiter).tokenize(headerLine).getValues();

            DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer(delimiter);
            tokenizer.setNames(header);

            int lineNumber = 1;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                records.add(parseLine(tokenizer, header, fileName, lineNumber, line));
            }
        }
        return records;
    }

    private RawRecord parseLine(DelimitedLineTokenizer tokenizer, String[] header,
                                String fileName, int lineNumber, String line) {
        FieldSet fieldSet;
        try {
            fieldSet = tokenizer.tokenize(line);
        } catch (IncorrectTokenCountException e) {
            log.debug("[{}] {}:{} has {} tokens, expected {}", source.ingestStage(), fileName, lineNumber,
                    e.getActualCount(), e.getExpectedCount());
            return RawRecord.malformed(source, fileName, lineNumber, Map.of(), line);
        }

        String[] values = fieldSet.getValues();
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < header.length; i++) {
            // Spark CSV 와 동일하게 빈 값은 null
            String value = values[i];
            fields.put(header[i], value == null || value.isEmpty() ? null : value);
        }

        Map<String, Object> rescued = schema.rescued(fields);
        if (!rescued.isEmpty()) {
            return RawRecord.malformed(source, fileName, lineNumber,
                    schema.conforming(fields), RescuedData.toJson(objectMapper, rescued));
        }
        return RawRecord.parsed(source, fileName, lineNumber, fields);
    }
}
