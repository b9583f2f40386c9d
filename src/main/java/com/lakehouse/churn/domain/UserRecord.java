package com.lakehouse.churn.domain;

import java.time.LocalDateTime;

/**
 * churn_users 테이블 매핑용 레코드
 *
 * email 은 SHA-1 해시, 이름은 initcap 처리된 값입니다.
 */
public record UserRecord(
        String userId,
        String email,
        LocalDateTime creationDate,
        LocalDateTime lastActivityDate,
        String firstname,
        String lastname,
        String address,
        String canal,
        String country,
        Integer gender,
        Integer ageGroup,
        Integer churn
) implements CleanRecord {

    @Override
    public String key() {
        return userId;
    }

    @Override
    public Object column(String name) {
        return switch (name) {
            case "user_id" -> userId;
            case "email" -> email;
            case "creation_date" -> creationDate;
            case "last_activity_date" -> lastActivityDate;
            case "firstname" -> firstname;
            case "lastname" -> lastname;
            case "address" -> address;
            case "canal" -> canal;
            case "country" -> country;
            case "gender" -> gender;
            case "age_group" -> ageGroup;
            case "churn" -> churn;
            default -> throw new IllegalArgumentException("Unknown users column: " + name);
        };
    }
}
