package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.CleanRecord;
import com.lakehouse.churn.domain.RawRecord;
import com.lakehouse.churn.domain.SourceName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.util.ArrayList;
import java.util.List;

/**
 * RawRecord → CleanRecord 변환 + Expectation 검사
 * <p>
 * 모든 Expectation 을 평가한 뒤 정책을 적용합니다.
 * FAIL 위반이 하나라도 있으면 예외, DROP_ROW 위반이 있으면 제외, ALERT 만 있으면 유지합니다.
 * 기본키가 없는 레코드는 silver 테이블에 저장할 수 없으므로 제외합니다.
 */
@Slf4j
public class CleaningProcessor<T extends CleanRecord> implements ItemProcessor<RawRecord, CleanedRow<T>> {

    static final String MISSING_KEY = "missing_key";

    private final SourceName source;
    private final RecordCleaner<T> cleaner;
    private final List<Expectation> expectations;

    public CleaningProcessor(SourceName source, RecordCleaner<T> cleaner, List<Expectation> expectations) {
        this.source = source;
        this.cleaner = cleaner;
        this.expectations = List.copyOf(expectations);
    }

    @Override
    public CleanedRow<T> process(RawRecord raw) {
        if (raw.malformed()) {
            return CleanedRow.malformed(raw.id());
        }

        T record = cleaner.clean(raw);

        List<String> violated = new ArrayList<>();
        List<String> fatal = new ArrayList<>();
        boolean drop = false;
        for (Expectation expectation : expectations) {
            if (expectation.isMetBy(record)) {
                continue;
            }
            violated.add(expectation.name());
            switch (expectation.policy()) {
                case FAIL -> fatal.add(expectation.name());
                case DROP_ROW -> drop = true;
                case ALERT -> log.warn("[{}] expectation {} violated at {}",
                        source.cleanStage(), expectation.name(), raw.origin());
            }
        }

        if (!fatal.isEmpty()) {
            throw new ConstraintViolationException(source, fatal, raw.origin());
        }
        if (!drop && record.key() == null) {
            violated.add(MISSING_KEY);
            drop = true;
        }
        return drop
                ? CleanedRow.dropped(raw.id(), violated)
                : CleanedRow.kept(raw.id(), record, violated);
    }
}
