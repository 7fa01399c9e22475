package com.musicinsights.listeninghistory.application.summary.dto;

import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row.ListeningStatsRow;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row.SummaryRow;

import java.time.Instant;

/**
 * 사용자별 청취 기록 요약.
 *
 * <p>이벤트가 1건 이상이면 {@code dateRangeStart <= dateRangeEnd}가 성립한다.</p>
 *
 * @param totalTracks          전체 이벤트 수
 * @param totalArtists         서로 다른 아티스트 수
 * @param totalListeningTimeMs 총 재생 시간(ms)
 * @param dateRangeStart       가장 이른 재생 시각
 * @param dateRangeEnd         가장 늦은 재생 시각
 * @param uploadedAt           요약 저장 시각
 */
public record UserDataSummary(
        long totalTracks,
        long totalArtists,
        long totalListeningTimeMs,
        Instant dateRangeStart,
        Instant dateRangeEnd,
        Instant uploadedAt
) {
    public static UserDataSummary of(ListeningStatsRow stats, Instant uploadedAt) {
        return new UserDataSummary(
                stats.totalTracks(),
                stats.totalArtists(),
                stats.totalListeningTimeMs(),
                stats.firstPlayedAt(),
                stats.lastPlayedAt(),
                uploadedAt
        );
    }

    public static UserDataSummary from(SummaryRow row) {
        return new UserDataSummary(
                row.totalTracks(),
                row.totalArtists(),
                row.totalListeningTimeMs(),
                row.dateRangeStart(),
                row.dateRangeEnd(),
                row.uploadedAt()
        );
    }

    public SummaryRow toRow(String userId) {
        return new SummaryRow(userId, totalTracks, totalArtists, totalListeningTimeMs,
                dateRangeStart, dateRangeEnd, uploadedAt);
    }
}
