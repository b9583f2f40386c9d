package com.lakehouse.churn.clean;

import com.lakehouse.churn.domain.RawRecord;
import com.lakehouse.churn.domain.UserRecord;

import java.time.format.DateTimeFormatter;

import static com.lakehouse.churn.clean.Coercions.asString;
import static com.lakehouse.churn.clean.Coercions.initCap;
import static com.lakehouse.churn.clean.Coercions.sha1;
import static com.lakehouse.churn.clean.Coercions.toInt;
import static com.lakehouse.churn.clean.Coercions.toTimestamp;

/**
 * 사용자 원천 정제: id → user_id, email 해시, 날짜 파싱, 이름 initcap, 범주형 int 변환
 */
public class UserCleaner implements RecordCleaner<UserRecord> {

    private final DateTimeFormatter timestampFormat;

    public UserCleaner(String timestampPattern) {
        this.timestampFormat = DateTimeFormatter.ofPattern(timestampPattern);
    }

    @Override
    public UserRecord clean(RawRecord raw) {
        return new UserRecord(
                asString(raw.field("id")),
                sha1(asString(raw.field("email"))),
                toTimestamp(raw.field("creation_date"), timestampFormat),
                toTimestamp(raw.field("last_activity_date"), timestampFormat),
                initCap(asString(raw.field("firstname"))),
                initCap(asString(raw.field("lastname"))),
                asString(raw.field("address")),
                asString(raw.field("canal")),
                asString(raw.field("country")),
                toInt(raw.field("gender")),
                toInt(raw.field("age_group")),
                toInt(raw.field("churn")));
    }
}
