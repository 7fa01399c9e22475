package com.musicinsights.listeninghistory.application.job;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * 완료된 job의 결과.
 *
 * @param totalTracks    사용자 전체 저장 이벤트 수
 * @param uploadedTracks 이번 실행에서 저장한 이벤트 수
 * @param newTracksCount 동기화에서 새로 추가된 이벤트 수(업로드 job은 null)
 * @param dateRangeStart 전체 기록의 가장 이른 재생 시각
 * @param dateRangeEnd   전체 기록의 가장 늦은 재생 시각
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResult(
        long totalTracks,
        long uploadedTracks,
        Long newTracksCount,
        Instant dateRangeStart,
        Instant dateRangeEnd
) {
}
