package com.musicinsights.listeninghistory.application.job;

import com.musicinsights.listeninghistory.application.common.error.ListeningPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * 요청 생명주기와 분리된 백그라운드 job 실행기.
 *
 * <p>요청은 job ID를 즉시 반환하고, 작업은 전용 스케줄러에서 독립적으로 계속된다.
 * 작업 결과는 job 상태(completed/failed)로만 노출된다.</p>
 */
@Component
public class DetachedJobRunner {

    private static final Logger log = LoggerFactory.getLogger(DetachedJobRunner.class);

    private final UploadJobTracker tracker;
    private final Scheduler scheduler;

    public DetachedJobRunner(UploadJobTracker tracker,
                             @Qualifier("ingestJobScheduler") Scheduler scheduler) {
        this.tracker = tracker;
        this.scheduler = scheduler;
    }

    /**
     * 작업을 분리 실행한다.
     *
     * <p>성공하면 결과와 함께 completed로, 예외가 나거나 결과 없이 끝나면 failed로 전환한다.</p>
     *
     * @param jobId             job ID
     * @param work              실행할 파이프라인
     * @param completionMessage completed 전환 시 기록할 메시지
     * @return 구독 핸들
     */
    public Disposable submit(String jobId, Mono<JobResult> work, String completionMessage) {
        return Mono.defer(() -> work)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Job finished without a result")))
                .subscribeOn(scheduler)
                .subscribe(
                        result -> {
                            tracker.complete(jobId, result, completionMessage);
                            log.info("[{}] job completed: uploaded={}, total={}",
                                    jobId, result.uploadedTracks(), result.totalTracks());
                        },
                        e -> {
                            log.error("[{}] job failed ({})", jobId, codeOf(e), e);
                            tracker.fail(jobId, reasonOf(e));
                        }
                );
    }

    private static String codeOf(Throwable e) {
        return e instanceof ListeningPipelineException
                ? ((ListeningPipelineException) e).code()
                : e.getClass().getSimpleName();
    }

    private static String reasonOf(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
