package com.musicinsights.listeninghistory.application.upload.service;

import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.application.common.error.NotFoundException;
import com.musicinsights.listeninghistory.application.job.JobIds;
import com.musicinsights.listeninghistory.application.job.JobResult;
import com.musicinsights.listeninghistory.application.job.JobStatus;
import com.musicinsights.listeninghistory.application.job.UploadJob;
import com.musicinsights.listeninghistory.application.job.UploadJobTracker;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.UserDataSummaryRepo;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * job 상태 조회 서비스.
 *
 * <p>추적 정보가 있으면 그대로 반환한다. 프로세스 재시작 등으로 추적 정보가 사라진 경우에는
 * job ID에 담긴 생성 시각과 사용자 요약의 갱신 시각으로 상태를 추정한다.</p>
 */
@Service
public class UploadStatusService {

    private final UploadJobTracker tracker;
    private final UserDataSummaryRepo summaryRepo;
    private final Clock clock;
    private final ListeningPipelineProperties.Job props;

    public UploadStatusService(UploadJobTracker tracker,
                               UserDataSummaryRepo summaryRepo,
                               Clock clock,
                               ListeningPipelineProperties props) {
        this.tracker = tracker;
        this.summaryRepo = summaryRepo;
        this.clock = clock;
        this.props = props.getJob();
    }

    /**
     * job 상태를 조회한다.
     *
     * @param jobId job ID
     * @return job 상태
     * @throws NotFoundException 알 수 없는 ID이거나 생성 시각이 미래이거나 보존 기간이 지난 경우
     */
    public Mono<UploadJob> status(String jobId) {
        return Mono.justOrEmpty(tracker.find(jobId))
                .switchIfEmpty(Mono.defer(() -> reconstruct(jobId)));
    }

    private Mono<UploadJob> reconstruct(String jobId) {
        Instant createdAt = JobIds.createdAt(jobId).orElse(null);
        String userId = JobIds.userId(jobId).orElse(null);
        if (createdAt == null || userId == null) {
            return Mono.error(jobNotFound(jobId));
        }

        Instant now = clock.instant();
        Duration age = Duration.between(createdAt, now);
        if (age.isNegative() || age.compareTo(props.getRetention()) > 0) {
            return Mono.error(jobNotFound(jobId));
        }

        return summaryRepo.findByUser(userId)
                .filter(row -> row.uploadedAt() != null && !row.uploadedAt().isBefore(createdAt))
                .map(row -> new UploadJob(
                        jobId, userId, JobStatus.COMPLETED, 100,
                        "Upload completed successfully",
                        new JobResult(row.totalTracks(), row.totalTracks(), null,
                                row.dateRangeStart(), row.dateRangeEnd()),
                        null, createdAt, row.uploadedAt()))
                .switchIfEmpty(Mono.fromCallable(() -> estimate(jobId, userId, createdAt, age, now)));
    }

    /**
     * 경과 시간으로 진행 상태를 추정한다.
     */
    UploadJob estimate(String jobId, String userId, Instant createdAt, Duration age, Instant now) {
        if (age.compareTo(props.getStuckAfter()) < 0) {
            long typical = Math.max(1L, props.getTypicalDuration().toMillis());
            int progress = (int) Math.min(95L, age.toMillis() * 100 / typical);
            return new UploadJob(jobId, userId, JobStatus.STORING, progress,
                    "Processing upload...", null, null, createdAt, now);
        }
        String reason = age.compareTo(props.getLostAfter()) < 0
                ? "Upload appears to be stuck"
                : "Upload was lost or interrupted";
        return new UploadJob(jobId, userId, JobStatus.FAILED, 0,
                "Failed: " + reason, null, reason, createdAt, now);
    }

    private static NotFoundException jobNotFound(String jobId) {
        return new NotFoundException("Job not found: " + jobId, "JOB_NOT_FOUND");
    }
}
