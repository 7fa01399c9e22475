package com.musicinsights.listeninghistory.application.aggregation.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * 미리 계산해 두는 집계 종류.
 */
public enum AggregationKind {
    DATE_FREQUENCY("date-frequency"),
    TIME_OF_DAY("time-of-day"),
    DAY_OF_WEEK("day-of-week"),
    TOP_TRACKS("top-tracks"),
    TOP_ARTISTS("top-artists");

    private final String value;

    AggregationKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Top-N 목록 종류인지 여부 */
    public boolean isTopList() {
        return this == TOP_TRACKS || this == TOP_ARTISTS;
    }

    public static Optional<AggregationKind> fromValue(String value) {
        return Arrays.stream(values()).filter(k -> k.value.equals(value)).findFirst();
    }
}
