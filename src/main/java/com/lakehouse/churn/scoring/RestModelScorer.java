package com.lakehouse.churn.scoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * MLflow pyfunc 서빙 엔드포인트 호출 스코어러
 * <p>
 * 요청: {"dataframe_records": [ {컬럼: 값, ...} ]}
 * 응답: {"predictions": [라벨]} 또는 [라벨]
 * 네트워크 오류와 5xx 는 재시도 대상(TransientScoringException), 그 외 오류는 즉시 실패입니다.
 */
@Slf4j
public class RestModelScorer implements ChurnScorer {

    private final RestTemplate restTemplate;
    private final URI endpoint;
    private final ObjectMapper objectMapper;
    private final ModelReference model;
    private final List<String> inputSchema;

    public RestModelScorer(RestTemplate restTemplate, URI endpoint, ObjectMapper objectMapper,
                           ModelReference model, List<String> inputSchema) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
        this.objectMapper = objectMapper;
        this.model = model;
        this.inputSchema = List.copyOf(inputSchema);
    }

    @Override
    public ModelReference model() {
        return model;
    }

    @Override
    public List<String> inputSchema() {
        return inputSchema;
    }

    @Override
    public Integer score(Map<String, Object> input) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> request = new HttpEntity<>(toJson(input), headers);

        String response;
        try {
            response = restTemplate.postForObject(endpoint, request, String.class);
        } catch (ResourceAccessException | HttpServerErrorException e) {
            throw new TransientScoringException("Model endpoint " + endpoint + " unavailable", e);
        } catch (RestClientException e) {
            throw new ScoringException("Model endpoint " + endpoint + " rejected request: " + e.getMessage(), e);
        }
        return parsePrediction(response);
    }

    private String toJson(Map<String, Object> input) {
        try {
            return objectMapper.writeValueAsString(Map.of("dataframe_records", List.of(input)));
        } catch (JsonProcessingException e) {
            throw new ScoringException("Cannot serialize scoring input " + input.keySet(), e);
        }
    }

    private Integer parsePrediction(String response) {
        if (response == null || response.isBlank()) {
            throw new ScoringException("Empty response from " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new ScoringException("Unreadable response from " + endpoint + ": " + response, e);
        }
        JsonNode predictions = root.isArray() ? root : root.path("predictions");
        if (!predictions.isArray() || predictions.isEmpty()) {
            throw new ScoringException("Response from " + endpoint + " has no predictions: " + response);
        }
        JsonNode prediction = predictions.get(0);
        if (prediction.isNull()) {
            return null;
        }
        if (!prediction.isNumber()) {
            throw new ScoringException("Non-numeric prediction from " + endpoint + ": " + prediction);
        }
        return prediction.intValue();
    }
}
