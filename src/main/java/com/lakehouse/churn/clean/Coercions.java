package com.lakehouse.churn.clean;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;

/**
 * 정제 단계 타입 변환 함수
 * <p>
 * 변환할 수 없는 값은 예외 대신 null 을 반환합니다. null 여부는 Expectation 이 판단합니다.
 */
public final class Coercions {

    private Coercions() {
    }

    public static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    /**
     * 소수는 0 방향으로 버림, int 범위를 벗어나거나 숫자가 아니면 null
     */
    public static Integer toInt(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        try {
            BigDecimal decimal = value instanceof Number number
                    ? new BigDecimal(number.toString())
                    : new BigDecimal(value.toString().trim());
            return decimal.setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    public static LocalDateTime toTimestamp(Object value, DateTimeFormatter format) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.toString().trim(), format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * 식별 정보 가명처리용 단방향 해시 (소문자 hex)
     */
    public static String sha1(String value) {
        if (value == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }

    /**
     * 공백으로 구분된 각 단어의 첫 글자만 대문자, 나머지는 소문자
     */
    public static String initCap(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (char c : value.toCharArray()) {
            if (Character.isWhitespace(c)) {
                sb.append(c);
                startOfWord = true;
            } else {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            }
        }
        return sb.toString();
    }
}
