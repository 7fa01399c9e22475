package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row;

import java.time.Instant;

/**
 * listening_aggregation 테이블의 한 행입니다.
 *
 * @param kind       집계 종류(date-frequency, time-of-day, ...)
 * @param groupBy    날짜 집계 단위(day/month/year), 그 외 종류는 null
 * @param payload    집계 결과(JSON 문자열)
 * @param computedAt 계산 시각
 */
public record AggregationRow(
        String kind,
        String groupBy,
        String payload,
        Instant computedAt
) {}
