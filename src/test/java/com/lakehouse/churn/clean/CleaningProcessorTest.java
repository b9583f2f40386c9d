package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.OrderRecord;
import com.lakehouse.churn.domain.RawRecord;
import com.lakehouse.churn.domain.SourceName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CleaningProcessorTest {

    private static final String PATTERN = "MM-dd-yyyy HH:mm:ss";

    private static final List<Expectation> ORDER_EXPECTATIONS = List.of(
            Expectation.notNull("order_valid_id", "order_id", ViolationPolicy.DROP_ROW),
            Expectation.notNull("order_valid_user_id", "user_id", ViolationPolicy.DROP_ROW));

    @Test
    @DisplayName("주문 원천을 타입 변환하여 OrderRecord 로 유지")
    void 정상_주문_정제() throws Exception {
        // given
        CleaningProcessor<OrderRecord> processor = orderProcessor(ORDER_EXPECTATIONS);
        RawRecord raw = order(1L, "10", "1", "50", "02-01-2020 00:00:00");

        // when
        CleanedRow<OrderRecord> row = processor.process(raw);

        // then
        assertThat(row.isKept()).isTrue();
        assertThat(row.rawId()).isEqualTo(1L);
        assertThat(row.record()).isEqualTo(new OrderRecord("10", "1", 50, 2,
                LocalDateTime.of(2020, 2, 1, 0, 0)));
    }

    @Test
    @DisplayName("DROP_ROW 위반은 제외되고 위반한 Expectation 이 모두 기록됨")
    void DROP_ROW_제외() throws Exception {
        // given
        CleaningProcessor<OrderRecord> processor = orderProcessor(ORDER_EXPECTATIONS);
        RawRecord raw = order(2L, null, null, "50", "02-01-2020 00:00:00");

        // when
        CleanedRow<OrderRecord> row = processor.process(raw);

        // then
        assertThat(row.outcome()).isEqualTo(CleanedRow.Outcome.DROPPED);
        assertThat(row.record()).isNull();
        assertThat(row.violations()).containsExactly("order_valid_id", "order_valid_user_id");
    }

    @Test
    @DisplayName("FAIL 위반은 ConstraintViolationException 으로 micro-batch 를 중단")
    void FAIL_예외() {
        // given
        CleaningProcessor<OrderRecord> processor = orderProcessor(List.of(
                new Expectation("order_positive_amount", "amount", Expectation.Check.NON_NEGATIVE,
                        ViolationPolicy.FAIL)));
        RawRecord raw = order(3L, "11", "1", "-5", "02-01-2020 00:00:00");

        // when & then
        assertThatThrownBy(() -> processor.process(raw))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessageContaining("order_positive_amount")
                .hasMessageContaining("orders_1.json:3");
    }

    @Test
    @DisplayName("ALERT 위반은 레코드를 유지하고 위반만 기록")
    void ALERT_유지() throws Exception {
        // given
        CleaningProcessor<OrderRecord> processor = orderProcessor(List.of(
                Expectation.notNull("order_has_date", "creation_date", ViolationPolicy.ALERT)));
        RawRecord raw = order(4L, "12", "1", "50", "not a date");

        // when
        CleanedRow<OrderRecord> row = processor.process(raw);

        // then
        assertThat(row.isKept()).isTrue();
        assertThat(row.record().creationDate()).isNull();
        assertThat(row.violations()).containsExactly("order_has_date");
    }

    @Test
    @DisplayName("Expectation 이 없어도 기본키가 null 이면 missing_key 로 제외")
    void 기본키_없음_제외() throws Exception {
        // given
        CleaningProcessor<OrderRecord> processor = orderProcessor(List.of());
        RawRecord raw = order(5L, null, "1", "50", "02-01-2020 00:00:00");

        // when
        CleanedRow<OrderRecord> row = processor.process(raw);

        // then
        assertThat(row.outcome()).isEqualTo(CleanedRow.Outcome.DROPPED);
        assertThat(row.violations()).containsExactly(CleaningProcessor.MISSING_KEY);
    }

    @Test
    @DisplayName("malformed 원천 레코드는 정제하지 않고 MALFORMED 로 집계")
    void malformed_제외() throws Exception {
        // given
        CleaningProcessor<OrderRecord> processor = orderProcessor(ORDER_EXPECTATIONS);
        RawRecord raw = RawRecord.malformed(SourceName.ORDERS, "orders_1.json", 7, Map.of(), "{broken")
                .withId(6L);

        // when
        CleanedRow<OrderRecord> row = processor.process(raw);

        // then
        assertThat(row.outcome()).isEqualTo(CleanedRow.Outcome.MALFORMED);
        assertThat(row.rawId()).isEqualTo(6L);
    }

    @Test
    @DisplayName("CleaningReport 는 결과별 건수와 Expectation 별 위반 건수를 집계")
    void 정제_리포트() throws Exception {
        // given
        CleaningProcessor<OrderRecord> processor = orderProcessor(ORDER_EXPECTATIONS);
        List<CleanedRow<OrderRecord>> rows = List.of(
                processor.process(order(1L, "10", "1", "50", "02-01-2020 00:00:00")),
                processor.process(order(2L, "11", null, "50", "02-01-2020 00:00:00")),
                processor.process(order(3L, null, null, "50", "02-01-2020 00:00:00")),
                processor.process(RawRecord.malformed(SourceName.ORDERS, "orders_1.json", 9, Map.of(), "x")
                        .withId(4L)));

        // when
        CleaningReport report = CleaningReport.of(SourceName.ORDERS, rows);

        // then
        assertThat(report.seen()).isEqualTo(4);
        assertThat(report.written()).isEqualTo(1);
        assertThat(report.dropped()).isEqualTo(2);
        assertThat(report.malformed()).isEqualTo(1);
        assertThat(report.violations())
                .containsEntry("order_valid_user_id", 2L)
                .containsEntry("order_valid_id", 1L);
    }

    private static CleaningProcessor<OrderRecord> orderProcessor(List<Expectation> expectations) {
        return new CleaningProcessor<>(SourceName.ORDERS, new OrderCleaner(PATTERN), expectations);
    }

    private static RawRecord order(long rawId, String id, String userId, String amount, String date) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("id", id);
        fields.put("user_id", userId);
        fields.put("amount", amount);
        fields.put("item_count", 2);
        fields.put("transaction_date", date);
        return RawRecord.parsed(SourceName.ORDERS, "orders_1.json", (int) rawId, fields).withId(rawId);
    }
}
