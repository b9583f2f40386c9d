package com.lakehouse.churn.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lakehouse.churn.domain.RawRecord;
import com.lakehouse.churn.domain.SourceName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON Lines 파서 (한 줄에 JSON 객체 하나)
 */
@Slf4j
@RequiredArgsConstructor
public class JsonLinesRawRecordParser implements RawRecordParser {

    private static final String BOM = "\uFEFF";

    private final SourceName source;
    private final SourceSchema schema;
    private final ObjectMapper objectMapper;

    @Override
    public List<RawRecord> parse(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        List<RawRecord> records = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int lineNumber = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && line.startsWith(BOM)) {
                    line = line.substring(1);
                }
                if (line.isBlank()) {
                    continue;
                }
                records.add(parseLine(fileName, lineNumber, line));
            }
        }
        return records;
    }

    private RawRecord parseLine(String fileName, int lineNumber, String line) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("[{}] {}:{} is not valid JSON: {}", source.ingestStage(), fileName, lineNumber,
                    e.getOriginalMessage());
            return RawRecord.malformed(source, fileName, lineNumber, Map.of(), line);
        }
        if (!node.isObject()) {
            return RawRecord.malformed(source, fileName, lineNumber, Map.of(), line);
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.put(entry.getKey(), toValue(entry.getValue()));
        }

        Map<String, Object> rescued = schema.rescued(fields);
        if (!rescued.isEmpty()) {
            return RawRecord.malformed(source, fileName, lineNumber,
                    schema.conforming(fields), RescuedData.toJson(objectMapper, rescued));
        }
        return RawRecord.parsed(source, fileName, lineNumber, fields);
    }

    private static Object toValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        // 중첩 객체 / 배열은 JSON 문자열 그대로 보관
        return value.toString();
    }
}
