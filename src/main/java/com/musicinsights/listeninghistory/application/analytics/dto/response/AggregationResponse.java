package com.musicinsights.listeninghistory.application.analytics.dto.response;

import com.musicinsights.listeninghistory.application.aggregation.dto.AggregationKind;
import com.musicinsights.listeninghistory.application.aggregation.dto.Grouping;

import java.time.Instant;
import java.util.List;

/**
 * 저장된 집계 조회 응답.
 *
 * @param kind       집계 종류
 * @param groupBy    날짜 단위(날짜 빈도에서만 값이 있음)
 * @param computed   집계가 계산된 적이 있는지 여부
 * @param computedAt 계산 시각(계산 전이면 null)
 * @param items      집계 항목
 */
public record AggregationResponse(
        AggregationKind kind,
        Grouping groupBy,
        boolean computed,
        Instant computedAt,
        List<?> items
) {
    public static AggregationResponse notComputed(AggregationKind kind, Grouping groupBy) {
        return new AggregationResponse(kind, groupBy, false, null, List.of());
    }
}
