package com.musicinsights.listeninghistory.application.job;

import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * job 생성/상태 전이를 담당하는 추적기.
 *
 * <p>보존 기간이 지난 항목은 타이머가 아니라 새 job 생성 시점에 정리한다.
 * 이미 정리된(또는 재시작으로 사라진) job에 대한 갱신은 경고 로그만 남기고 무시한다.</p>
 */
@Component
public class UploadJobTracker {

    private static final Logger log = LoggerFactory.getLogger(UploadJobTracker.class);

    private final UploadJobStore store;
    private final Clock clock;
    private final ListeningPipelineProperties props;

    public UploadJobTracker(UploadJobStore store, Clock clock, ListeningPipelineProperties props) {
        this.store = store;
        this.clock = clock;
        this.props = props;
    }

    /**
     * pending 상태의 job을 생성한다. 생성 전에 보존 기간이 지난 job을 정리한다.
     *
     * @param userId 소유 사용자 ID
     * @return 생성된 job
     */
    public UploadJob create(String userId) {
        Instant now = clock.instant();
        int removed = store.removeCreatedBefore(now.minus(props.getJob().getRetention()));
        if (removed > 0) {
            log.debug("Swept {} expired upload jobs", removed);
        }

        UploadJob job = UploadJob.pending(JobIds.newId(userId, now), userId, "Upload started", now);
        store.save(job);
        return job;
    }

    public Optional<UploadJob> find(String jobId) {
        return store.find(jobId);
    }

    /**
     * job을 다음 단계로 옮기거나 같은 단계의 진행률을 갱신한다.
     *
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public Optional<UploadJob> advance(String jobId, JobStatus status, int progress, String message) {
        return update(jobId, job -> job.advance(status, progress, message, clock.instant()));
    }

    public Optional<UploadJob> complete(String jobId, JobResult result, String message) {
        return update(jobId, job -> job.complete(result, message, clock.instant()));
    }

    public Optional<UploadJob> fail(String jobId, String reason) {
        return update(jobId, job -> job.fail(reason, clock.instant()));
    }

    /**
     * 특정 job에 진행 상황을 기록하는 {@link JobProgress}를 반환한다.
     *
     * @param jobId job ID
     * @return 진행 상황 기록기
     */
    public JobProgress progressOf(String jobId) {
        return (status, progress, message) -> advance(jobId, status, progress, message);
    }

    private Optional<UploadJob> update(String jobId, UnaryOperator<UploadJob> change) {
        Optional<UploadJob> current = store.find(jobId);
        if (current.isEmpty()) {
            log.warn("[{}] job entry not found, update skipped", jobId);
            return Optional.empty();
        }
        UploadJob next = change.apply(current.get());
        store.save(next);
        return Optional.of(next);
    }
}
