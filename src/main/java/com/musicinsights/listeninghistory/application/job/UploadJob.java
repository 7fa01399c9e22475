package com.musicinsights.listeninghistory.application.job;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * 한 번의 적재 실행(업로드 또는 동기화)의 상태 스냅샷.
 *
 * <p>불변 객체이며 상태 변경은 항상 새 인스턴스를 반환한다.
 * 진행률은 감소하지 않고, result는 completed 진입 시에만, error는 failed 진입 시에만 채워진다.</p>
 *
 * @param id        job ID(사용자 ID + 생성 시각)
 * @param userId    소유 사용자
 * @param status    현재 상태
 * @param progress  진행률(0~100)
 * @param message   현재 단계 설명
 * @param result    완료 결과(completed에서만)
 * @param error     실패 사유(failed에서만)
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 갱신 시각
 */
public record UploadJob(
        String id,
        @JsonIgnore String userId,
        JobStatus status,
        int progress,
        String message,
        JobResult result,
        String error,
        Instant createdAt,
        Instant updatedAt
) {

    /**
     * pending 상태의 새 job을 만든다.
     */
    public static UploadJob pending(String id, String userId, String message, Instant now) {
        return new UploadJob(id, userId, JobStatus.PENDING, 0, message, null, null, now, now);
    }

    /**
     * 다음 단계(또는 같은 단계 내 진행률 갱신)로 이동한다.
     *
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public UploadJob advance(JobStatus next, int newProgress, String newMessage, Instant now) {
        if (next == JobStatus.COMPLETED || next == JobStatus.FAILED) {
            throw new IllegalStateException("Use complete()/fail() to enter terminal state " + next.value());
        }
        requireAllowed(next);
        return new UploadJob(id, userId, next, clampProgress(newProgress), newMessage, null, null, createdAt, now);
    }

    /**
     * completed로 전환한다. storing 단계에서만 가능하다.
     */
    public UploadJob complete(JobResult jobResult, String newMessage, Instant now) {
        requireAllowed(JobStatus.COMPLETED);
        return new UploadJob(id, userId, JobStatus.COMPLETED, 100, newMessage, jobResult, null, createdAt, now);
    }

    /**
     * failed로 전환한다. 진행률은 실패 시점 값을 유지한다.
     */
    public UploadJob fail(String reason, Instant now) {
        requireAllowed(JobStatus.FAILED);
        return new UploadJob(id, userId, JobStatus.FAILED, progress, "Failed: " + reason, null, reason, createdAt, now);
    }

    private void requireAllowed(JobStatus next) {
        if (!status.allows(next)) {
            throw new IllegalStateException(
                    "Illegal job transition " + status.value() + " -> " + next.value() + " (job " + id + ")");
        }
    }

    private int clampProgress(int requested) {
        int bounded = Math.max(0, Math.min(100, requested));
        return Math.max(progress, bounded);
    }
}
