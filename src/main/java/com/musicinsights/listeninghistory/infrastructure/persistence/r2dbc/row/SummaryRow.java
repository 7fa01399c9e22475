package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row;

import java.time.Instant;

/**
 * user_data_summary 테이블의 한 행입니다.
 *
 * @param userId               사용자 ID
 * @param totalTracks          전체 이벤트 수
 * @param totalArtists         서로 다른 아티스트 수
 * @param totalListeningTimeMs 총 재생 시간(ms)
 * @param dateRangeStart       가장 이른 재생 시각
 * @param dateRangeEnd         가장 늦은 재생 시각
 * @param uploadedAt           요약이 마지막으로 저장된 시각(완료 표식으로도 사용)
 */
public record SummaryRow(
        String userId,
        long totalTracks,
        long totalArtists,
        long totalListeningTimeMs,
        Instant dateRangeStart,
        Instant dateRangeEnd,
        Instant uploadedAt
) {}
