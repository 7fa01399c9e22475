package com.musicinsights.listeninghistory.application.analytics.dto.response;

import com.musicinsights.listeninghistory.application.summary.dto.UserDataSummary;

/**
 * 사용자 요약 조회 응답.
 *
 * @param summary    요약(데이터가 없으면 null)
 * @param totalCount 전체 이벤트 수
 */
public record SummaryResponse(
        UserDataSummary summary,
        long totalCount
) {
    public static SummaryResponse of(UserDataSummary summary) {
        return new SummaryResponse(summary, summary.totalTracks());
    }

    public static SummaryResponse empty() {
        return new SummaryResponse(null, 0L);
    }
}
