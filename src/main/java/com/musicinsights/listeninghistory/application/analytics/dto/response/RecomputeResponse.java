package com.musicinsights.listeninghistory.application.analytics.dto.response;

import com.musicinsights.listeninghistory.application.summary.dto.UserDataSummary;

/**
 * 요약/집계 재계산 응답.
 *
 * @param summary       재계산된 요약
 * @param eventsScanned 집계에 사용한 이벤트 수
 */
public record RecomputeResponse(
        UserDataSummary summary,
        long eventsScanned
) {}
