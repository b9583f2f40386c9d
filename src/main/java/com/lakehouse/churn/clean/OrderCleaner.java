package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.OrderRecord;
import com.lakehouse.churn.domain.RawRecord;

import java.time.format.DateTimeFormatter;

import static com.lakehouse.churn.clean.Coercions.asString;
import static com.lakehouse.churn.clean.Coercions.toInt;
import static com.lakehouse.churn.clean.Coercions.toTimestamp;

public class OrderCleaner implements RecordCleaner<OrderRecord> {

    private final DateTimeFormatter timestampFormat;

    public OrderCleaner(String timestampPattern) {
        this.timestampFormat = DateTimeFormatter.ofPattern(timestampPattern);
    }

    @Override
    public OrderRecord clean(RawRecord raw) {
        return new OrderRecord(
                asString(raw.field("id")),
                asString(raw.field("user_id")),
                toInt(raw.field("amount")),
                toInt(raw.field("item_count")),
                toTimestamp(raw.field("transaction_date"), timestampFormat));
    }
}
