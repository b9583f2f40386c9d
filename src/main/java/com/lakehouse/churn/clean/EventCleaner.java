package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.EventRecord;
import com.lakehouse.churn.domain.RawRecord;

import java.time.format.DateTimeFormatter;

import static com.lakehouse.churn.clean.Coercions.asString;
import static com.lakehouse.churn.clean.Coercions.toTimestamp;

public class EventCleaner implements RecordCleaner<EventRecord> {

    private final DateTimeFormatter timestampFormat;

    public EventCleaner(String timestampPattern) {
        this.timestampFormat = DateTimeFormatter.ofPattern(timestampPattern);
    }

    @Override
    public EventRecord clean(RawRecord raw) {
        return new EventRecord(
                raw.origin(),
                asString(raw.field("user_id")),
                asString(raw.field("event_id")),
                asString(raw.field("session_id")),
                asString(raw.field("platform")),
                toTimestamp(raw.field("date"), timestampFormat),
                asString(raw.field("action")),
                asString(raw.field("url")));
    }
}
