package com.musicinsights.listeninghistory.application.sync.service;

import com.musicinsights.listeninghistory.application.aggregation.service.ListeningAggregationService;
import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.application.job.DetachedJobRunner;
import com.musicinsights.listeninghistory.application.job.JobProgress;
import com.musicinsights.listeninghistory.application.job.JobStatus;
import com.musicinsights.listeninghistory.application.job.UploadJob;
import com.musicinsights.listeninghistory.application.job.UploadJobTracker;
import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import com.musicinsights.listeninghistory.application.summary.service.SummaryCalculator;
import com.musicinsights.listeninghistory.infrastructure.input.spotify.RecentlyPlayedSource;
import com.musicinsights.listeninghistory.infrastructure.mapper.ArtistNameMode;
import com.musicinsights.listeninghistory.infrastructure.mapper.ListeningEventNormalizer;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.ListeningBatchWriter;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.ListeningEventRepo;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.UserSyncTokenRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * "최근 재생" 기반 증분 동기화 서비스.
 *
 * <p>흐름: 최근 저장 N건 조회(참조 구간) → since 기준 이후 항목 조회 → 정규화 → 중복 제거
 * → 배치 저장 → 집계 재계산(실패 무시) → 요약 갱신</p>
 */
@Service
public class ListeningSyncService {

    private static final Logger log = LoggerFactory.getLogger(ListeningSyncService.class);

    private final ListeningEventRepo eventRepo;
    private final UserSyncTokenRepo tokenRepo;
    private final RecentlyPlayedSource source;
    private final ListeningEventNormalizer normalizer;
    private final ListeningDeduplicator deduplicator;
    private final ListeningBatchWriter writer;
    private final ListeningAggregationService aggregationService;
    private final SummaryCalculator summaryCalculator;
    private final UploadJobTracker tracker;
    private final DetachedJobRunner runner;
    private final Clock clock;
    private final ListeningPipelineProperties.Sync props;

    public ListeningSyncService(ListeningEventRepo eventRepo,
                                UserSyncTokenRepo tokenRepo,
                                RecentlyPlayedSource source,
                                ListeningEventNormalizer normalizer,
                                ListeningDeduplicator deduplicator,
                                ListeningBatchWriter writer,
                                ListeningAggregationService aggregationService,
                                SummaryCalculator summaryCalculator,
                                UploadJobTracker tracker,
                                DetachedJobRunner runner,
                                Clock clock,
                                ListeningPipelineProperties props) {
        this.eventRepo = eventRepo;
        this.tokenRepo = tokenRepo;
        this.source = source;
        this.normalizer = normalizer;
        this.deduplicator = deduplicator;
        this.writer = writer;
        this.aggregationService = aggregationService;
        this.summaryCalculator = summaryCalculator;
        this.tracker = tracker;
        this.runner = runner;
        this.clock = clock;
        this.props = props.getSync();
    }

    /**
     * 동기화 job을 만들고 백그라운드에서 실행한다. 토큰은 주기 동기화를 위해 저장한다.
     *
     * @param userId      사용자 ID
     * @param accessToken 외부 API 접근 토큰
     * @return 생성된 job(pending)
     */
    public Mono<UploadJob> start(String userId, String accessToken) {
        return tokenRepo.save(userId, accessToken, clock.instant())
                .onErrorResume(e -> {
                    log.warn("Failed to store sync token for user {} (ignored): {}", userId, e.getMessage());
                    return Mono.just(0L);
                })
                .map(n -> {
                    UploadJob job = tracker.create(userId);
                    runner.submit(job.id(),
                            sync(userId, accessToken, tracker.progressOf(job.id())).map(SyncResult::toJobResult),
                            "Sync completed successfully");
                    return job;
                });
    }

    /**
     * 증분 동기화를 실행한다.
     *
     * @param userId      사용자 ID
     * @param accessToken 외부 API 접근 토큰
     * @param progress    진행 상황 기록기
     * @return 동기화 결과
     */
    public Mono<SyncResult> sync(String userId, String accessToken, JobProgress progress) {
        return Mono.fromRunnable(() -> progress.advance(JobStatus.EXTRACTING, 10, "Fetching recently played tracks..."))
                .then(Mono.defer(() -> eventRepo.findRecent(userId, props.getDedupWindow()).collectList()))
                .flatMap(reference -> fetchNew(userId, accessToken, reference, progress))
                .flatMap(batch -> store(userId, batch, progress));
    }

    private Mono<FetchedBatch> fetchNew(String userId, String accessToken,
                                        List<ListeningEvent> reference, JobProgress progress) {
        Instant since = deduplicator.sinceBoundary(reference).orElse(null);
        log.info("Syncing user {} since {}", userId, since == null ? "beginning" : since);

        return source.fetchSince(accessToken, since, props.getMaxTracks())
                .map(item -> normalizer.fromRecentlyPlayed(item, ArtistNameMode.JOINED))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collectList()
                .map(fetched -> {
                    List<ListeningEvent> fresh = deduplicator.filterNew(fetched, reference);
                    progress.advance(JobStatus.PROCESSING, 30,
                            "Processing " + fresh.size() + " new tracks (" + fetched.size() + " fetched)...");
                    return new FetchedBatch(fetched.size(), fresh);
                });
    }

    private Mono<SyncResult> store(String userId, FetchedBatch batch, JobProgress progress) {
        List<ListeningEvent> fresh = batch.fresh();
        progress.advance(JobStatus.STORING, 40, "Storing " + fresh.size() + " new tracks...");

        Mono<Boolean> written = fresh.isEmpty()
                ? Mono.just(false)
                : writer.write(userId, fresh, (percent, message) ->
                                progress.advance(JobStatus.STORING, 40 + percent * 40 / 100, message))
                        .then(Mono.defer(() -> aggregationService.recomputeQuietly(userId)));

        return written
                .then(Mono.fromRunnable(() -> progress.advance(JobStatus.STORING, 90, "Updating summary...")))
                .then(Mono.defer(() -> summaryCalculator.recompute(userId)))
                .map(summary -> {
                    log.info("Sync finished for user {}: fetched={}, new={}, total={}",
                            userId, batch.fetchedCount(), fresh.size(), summary.totalTracks());
                    return new SyncResult(batch.fetchedCount(), fresh.size(), summary);
                });
    }

    /** 조회 결과(정규화 후 건수 + 중복 제거 후 이벤트) */
    private record FetchedBatch(long fetchedCount, List<ListeningEvent> fresh) {}
}
