package com.musicinsights.listeninghistory.application.sync.service;

import com.musicinsights.listeninghistory.application.job.JobResult;
import com.musicinsights.listeninghistory.application.summary.dto.UserDataSummary;

/**
 * 한 번의 증분 동기화 결과.
 *
 * @param fetchedCount   외부에서 가져온 이벤트 수(정규화 후)
 * @param newTracksCount 중복 제거 후 새로 저장한 이벤트 수
 * @param summary        동기화 후 사용자 요약
 */
public record SyncResult(long fetchedCount, long newTracksCount, UserDataSummary summary) {

    public JobResult toJobResult() {
        return new JobResult(
                summary.totalTracks(),
                newTracksCount,
                newTracksCount,
                summary.dateRangeStart(),
                summary.dateRangeEnd()
        );
    }
}
