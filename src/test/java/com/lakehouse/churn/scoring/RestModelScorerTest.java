package com.lakehouse.churn.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestModelScorerTest {

    private static final URI ENDPOINT = URI.create("http://models.local/serving-endpoints/churn/invocations");

    private MockRestServiceServer server;
    private RestModelScorer scorer;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        scorer = new RestModelScorer(restTemplate, ENDPOINT, new ObjectMapper(),
                new ModelReference("dbdemos_customer_churn", "Production"),
                List.of("user_id", "days_last_event"));
    }

    @Test
    @DisplayName("dataframe_records 형식으로 요청하고 predictions 첫 값을 예측으로 사용")
    void MLflow_서빙_프로토콜() {
        // given
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().json("""
                        {"dataframe_records": [{"user_id": "1", "days_last_event": 29}]}
                        """))
                .andRespond(withSuccess("{\"predictions\": [1]}", MediaType.APPLICATION_JSON));

        // when
        Integer prediction = scorer.score(input("1", 29L));

        // then
        assertThat(prediction).isEqualTo(1);
        server.verify();
    }

    @Test
    @DisplayName("배열 형태 응답과 null 예측도 처리")
    void 배열응답_null예측() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("[0]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"predictions\": [null]}", MediaType.APPLICATION_JSON));

        assertThat(scorer.score(input("1", 1L))).isEqualTo(0);
        assertThat(scorer.score(input("2", null))).isNull();
    }

    @Test
    @DisplayName("5xx 와 연결 실패는 재시도 대상 예외")
    void 서버오류_일시적실패() {
        server.expect(requestTo(ENDPOINT)).andRespond(withServerError());
        server.expect(requestTo(ENDPOINT)).andRespond(withException(new IOException("connection refused")));

        assertThatThrownBy(() -> scorer.score(input("1", 1L))).isInstanceOf(TransientScoringException.class);
        assertThatThrownBy(() -> scorer.score(input("1", 1L))).isInstanceOf(TransientScoringException.class);
    }

    @Test
    @DisplayName("4xx 나 predictions 없는 응답은 재시도하지 않는 실패")
    void 요청오류_영구실패() {
        server.expect(requestTo(ENDPOINT)).andRespond(withBadRequest());
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"error_code\": \"BAD_REQUEST\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> scorer.score(input("1", 1L)))
                .isInstanceOf(ScoringException.class)
                .isNotInstanceOf(TransientScoringException.class);
        assertThatThrownBy(() -> scorer.score(input("1", 1L)))
                .isInstanceOf(ScoringException.class)
                .hasMessageContaining("no predictions");
    }

    private static Map<String, Object> input(String userId, Long daysLastEvent) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("user_id", userId);
        input.put("days_last_event", daysLastEvent);
        return input;
    }
}
