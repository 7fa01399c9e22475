package com.musicinsights.listeninghistory.application.analytics.dto.response;

/**
 * 사용자 데이터 삭제 응답.
 *
 * @param deletedEvents       삭제된 청취 이벤트 수
 * @param deletedAggregations 삭제된 집계 행 수
 * @param summaryDeleted      요약 행 삭제 여부
 */
public record PurgeResponse(
        long deletedEvents,
        long deletedAggregations,
        boolean summaryDeleted
) {}
