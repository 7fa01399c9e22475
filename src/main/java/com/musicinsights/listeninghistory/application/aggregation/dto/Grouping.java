package com.musicinsights.listeninghistory.application.aggregation.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * 날짜 빈도 집계의 단위. 날짜 빈도 외 집계에는 적용하지 않는다.
 */
public enum Grouping {
    DAY("day"),
    MONTH("month"),
    YEAR("year");

    private final String value;

    Grouping(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<Grouping> fromValue(String value) {
        return Arrays.stream(values()).filter(g -> g.value.equals(value)).findFirst();
    }
}
