package com.musicinsights.listeninghistory.application.job;

/**
 * 파이프라인 단계가 진행 상황을 알리는 통로.
 */
@FunctionalInterface
public interface JobProgress {

    /** 진행 상황을 기록하지 않는 구현(스케줄 동기화, CLI 적재 등) */
    JobProgress NONE = (status, progress, message) -> { };

    void advance(JobStatus status, int progress, String message);
}
