package com.musicinsights.listeninghistory.application.upload.service;

import com.musicinsights.listeninghistory.application.aggregation.service.ListeningAggregationService;
import com.musicinsights.listeninghistory.application.common.error.VerificationException;
import com.musicinsights.listeninghistory.application.job.DetachedJobRunner;
import com.musicinsights.listeninghistory.application.job.JobProgress;
import com.musicinsights.listeninghistory.application.job.JobResult;
import com.musicinsights.listeninghistory.application.job.JobStatus;
import com.musicinsights.listeninghistory.application.job.UploadJob;
import com.musicinsights.listeninghistory.application.job.UploadJobTracker;
import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import com.musicinsights.listeninghistory.application.summary.service.SummaryCalculator;
import com.musicinsights.listeninghistory.infrastructure.input.archive.ArchiveExtractor;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.ListeningBatchWriter;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.ListeningEventRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 내보내기 파일(zip 또는 json) 적재 파이프라인.
 *
 * <p>단계별 진행률:
 * extracting 15% → processing 25% → storing 30%(기존 데이터 정리) → 30~90%(배치 저장)
 * → 90%(요약 계산) → 95%(집계 재계산 후 마무리) → completed 100%</p>
 *
 * <p>기존 데이터는 업로드 범위의 가장 늦은 재생 시각까지만 삭제하므로,
 * 그 이후에 동기화된 더 최신 데이터는 보존된다.</p>
 */
@Service
public class ListeningIngestService {

    private static final Logger log = LoggerFactory.getLogger(ListeningIngestService.class);

    private final ArchiveExtractor extractor;
    private final ListeningEventRepo eventRepo;
    private final ListeningBatchWriter writer;
    private final SummaryCalculator summaryCalculator;
    private final ListeningAggregationService aggregationService;
    private final UploadJobTracker tracker;
    private final DetachedJobRunner runner;

    public ListeningIngestService(ArchiveExtractor extractor,
                                  ListeningEventRepo eventRepo,
                                  ListeningBatchWriter writer,
                                  SummaryCalculator summaryCalculator,
                                  ListeningAggregationService aggregationService,
                                  UploadJobTracker tracker,
                                  DetachedJobRunner runner) {
        this.extractor = extractor;
        this.eventRepo = eventRepo;
        this.writer = writer;
        this.summaryCalculator = summaryCalculator;
        this.aggregationService = aggregationService;
        this.tracker = tracker;
        this.runner = runner;
    }

    /**
     * 적재 job을 만들고 백그라운드에서 실행한다. 호출자는 job ID를 즉시 돌려받는다.
     *
     * @param userId   사용자 ID
     * @param fileName 업로드 파일 이름
     * @param content  파일 내용
     * @return 생성된 job(pending)
     */
    public UploadJob start(String userId, String fileName, byte[] content) {
        UploadJob job = tracker.create(userId);
        log.info("[{}] Starting background processing for user {}, file: {} ({} bytes)",
                job.id(), userId, fileName, content.length);
        runner.submit(job.id(), ingest(userId, fileName, content, tracker.progressOf(job.id())),
                "Upload completed successfully");
        return job;
    }

    /**
     * 파이프라인을 실행한다.
     *
     * @param userId   사용자 ID
     * @param fileName 파일 이름(.zip이면 아카이브, 그 외는 단일 JSON 문서)
     * @param content  파일 내용
     * @param progress 진행 상황 기록기
     * @return 완료 결과
     */
    public Mono<JobResult> ingest(String userId, String fileName, byte[] content, JobProgress progress) {
        boolean archive = isArchive(fileName);
        return Mono.fromRunnable(() -> progress.advance(JobStatus.EXTRACTING, 15,
                        archive ? "Extracting files from ZIP..." : "Reading JSON file..."))
                .then(Mono.defer(() -> archive
                        ? extractor.extract(content)
                        : extractor.extractDocument(fileName, content)))
                .map(events -> process(events, progress))
                .flatMap(batch -> store(userId, batch, progress));
    }

    private UploadBatch process(List<ListeningEvent> events, JobProgress progress) {
        progress.advance(JobStatus.PROCESSING, 25, "Processing " + events.size() + " tracks...");
        Instant oldest = events.stream().map(ListeningEvent::playedAt).min(Comparator.naturalOrder()).orElseThrow();
        Instant newest = events.stream().map(ListeningEvent::playedAt).max(Comparator.naturalOrder()).orElseThrow();
        log.info("Uploaded data date range: {} to {}", oldest, newest);
        return new UploadBatch(events, oldest, newest);
    }

    private Mono<JobResult> store(String userId, UploadBatch batch, JobProgress progress) {
        List<ListeningEvent> events = batch.events();
        progress.advance(JobStatus.STORING, 30, "Storing " + events.size() + " tracks in database...");

        return purgeUpTo(userId, batch.newest())
                .then(Mono.defer(() -> writer.write(userId, events, (percent, message) ->
                        progress.advance(JobStatus.STORING, 30 + percent * 60 / 100, message))))
                .flatMap(written -> verify(userId, written))
                .flatMap(written -> {
                    progress.advance(JobStatus.STORING, 90, "Calculating summary statistics...");
                    return summaryCalculator.recompute(userId)
                            .flatMap(summary -> aggregationService.recomputeQuietly(userId)
                                    .then(Mono.fromCallable(() -> {
                                        progress.advance(JobStatus.STORING, 95, "Finalizing upload...");
                                        return new JobResult(
                                                summary.totalTracks(),
                                                written,
                                                null,
                                                summary.dateRangeStart(),
                                                summary.dateRangeEnd()
                                        );
                                    })));
                });
    }

    /**
     * 업로드 범위의 가장 늦은 재생 시각까지 기존 이벤트를 삭제한다. 실패해도 적재는 계속한다.
     */
    private Mono<Long> purgeUpTo(String userId, Instant newest) {
        return eventRepo.deleteByUserUpTo(userId, newest)
                .doOnNext(n -> log.info("Deleted {} existing events up to {} for user {}", n, newest, userId))
                .onErrorResume(e -> {
                    log.warn("Could not delete existing events for user {} (ignored): {}", userId, e.getMessage());
                    return Mono.just(0L);
                });
    }

    /**
     * 저장 직후 사용자 행이 실제로 조회되는지 확인한다.
     */
    private Mono<Long> verify(String userId, long written) {
        if (written == 0) return Mono.just(0L);
        return eventRepo.countByUser(userId)
                .flatMap(count -> count == 0
                        ? Mono.error(new VerificationException(userId, written))
                        : Mono.just(written));
    }

    static boolean isArchive(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    /** 정규화가 끝난 업로드 이벤트와 그 기간 */
    private record UploadBatch(List<ListeningEvent> events, Instant oldest, Instant newest) {}
}
