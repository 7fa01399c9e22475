package com.musicinsights.listeninghistory.application.aggregation.dto;

import java.time.Instant;
import java.util.List;

/**
 * 저장소에서 읽어 온 집계 결과 하나.
 *
 * @param kind       집계 종류
 * @param grouping   날짜 단위(날짜 빈도 외에는 null)
 * @param items      집계 항목(종류에 맞는 DTO 목록)
 * @param computedAt 계산 시각
 */
public record StoredAggregation(
        AggregationKind kind,
        Grouping grouping,
        List<?> items,
        Instant computedAt
) {
}
