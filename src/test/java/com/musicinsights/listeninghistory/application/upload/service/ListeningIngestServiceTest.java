package com.musicinsights.listeninghistory.application.upload.service;

import com.musicinsights.listeninghistory.application.aggregation.dto.AggregationKind;
import com.musicinsights.listeninghistory.application.aggregation.service.AggregationEngine;
import com.musicinsights.listeninghistory.application.aggregation.service.ListeningAggregationService;
import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.application.common.error.ExtractionException;
import com.musicinsights.listeninghistory.application.common.error.VerificationException;
import com.musicinsights.listeninghistory.application.job.DetachedJobRunner;
import com.musicinsights.listeninghistory.application.job.InMemoryUploadJobStore;
import com.musicinsights.listeninghistory.application.job.JobStatus;
import com.musicinsights.listeninghistory.application.job.MutableClock;
import com.musicinsights.listeninghistory.application.job.UploadJob;
import com.musicinsights.listeninghistory.application.job.UploadJobTracker;
import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import com.musicinsights.listeninghistory.application.listening.model.ListeningSource;
import com.musicinsights.listeninghistory.application.summary.dto.UserDataSummary;
import com.musicinsights.listeninghistory.application.summary.service.SummaryCalculator;
import com.musicinsights.listeninghistory.infrastructure.input.ExportFixtures;
import com.musicinsights.listeninghistory.infrastructure.input.archive.ArchiveExtractor;
import com.musicinsights.listeninghistory.infrastructure.input.export.ExportDocumentParser;
import com.musicinsights.listeninghistory.infrastructure.mapper.ListeningEventNormalizer;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.H2TestDatabase;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.ListeningBatchWriter;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.ListeningAggregationRepo;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.ListeningEventRepo;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.UserDataSummaryRepo;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * {@link ListeningIngestService} 테스트.
 *
 * <p>H2 저장소 위에서 업로드 전체 흐름(추출 → 기존 범위 정리 → 배치 저장 → 검증 → 요약/집계)을 실행하고,
 * 저장소 장애 경로는 mock으로 검증한다.</p>
 */
@DisplayName("listening ingest service 테스트")
class ListeningIngestServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private static H2TestDatabase database;

    private final ListeningPipelineProperties props = new ListeningPipelineProperties();
    private final MutableClock clock = new MutableClock(NOW);
    private final ArchiveExtractor extractor = new ArchiveExtractor(
            new ExportDocumentParser(JsonMapper.builder().build()), new ListeningEventNormalizer());

    private ListeningEventRepo eventRepo;
    private UploadJobTracker tracker;
    private ListeningAggregationService aggregationService;
    private ListeningIngestService service;

    @BeforeAll
    static void init() {
        database = H2TestDatabase.create("listening_ingest_service");
    }

    @BeforeEach
    void setUp() {
        database.clear();
        eventRepo = new ListeningEventRepo(database.client());
        tracker = new UploadJobTracker(new InMemoryUploadJobStore(), clock, props);
        aggregationService = new ListeningAggregationService(
                eventRepo, new ListeningAggregationRepo(database.client()),
                new AggregationEngine(props), JsonMapper.builder().build(),
                database.transactionalOperator(), clock, props);
        service = newService(eventRepo, new SummaryCalculator(
                eventRepo, new UserDataSummaryRepo(database.client()), clock, props), aggregationService);
    }

    @DisplayName("손상된 파일이 섞인 zip에서 유효한 재생만 저장하고 요약을 계산하는지 검증")
    @Test
    void ingest_zip_skipsCorruptEntry() {
        // given
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("MyData/StreamingHistory_music_0.json", ExportFixtures.ACCOUNT_HISTORY);
        entries.put("MyData/StreamingHistory_music_1.json", "[{ broken");
        List<String> steps = new ArrayList<>();

        // when / then
        StepVerifier.create(service.ingest("u1", "my_spotify_data.zip", ExportFixtures.zip(entries),
                        (status, progress, message) -> steps.add(status.value() + ":" + progress)))
                .assertNext(r -> {
                    assertThat(r.totalTracks()).isEqualTo(2L);
                    assertThat(r.uploadedTracks()).isEqualTo(2L);
                    assertThat(r.newTracksCount()).isNull();
                    assertThat(r.dateRangeStart()).isEqualTo(Instant.parse("2024-01-01T10:00:00Z"));
                    assertThat(r.dateRangeEnd()).isEqualTo(Instant.parse("2024-01-02T22:30:00Z"));
                })
                .verifyComplete();

        assertThat(steps).startsWith("extracting:15", "processing:25", "storing:30");
        assertThat(steps).endsWith("storing:90", "storing:95");
        assertThat(steps).contains("storing:90");

        StepVerifier.create(new UserDataSummaryRepo(database.client()).findByUser("u1"))
                .assertNext(row -> assertThat(row.totalListeningTimeMs()).isEqualTo(3000L))
                .verifyComplete();
        StepVerifier.create(aggregationService.find("u1", AggregationKind.TOP_ARTISTS, null))
                .assertNext(stored -> assertThat(stored.items()).hasSize(2))
                .verifyComplete();
    }

    @DisplayName("단일 JSON 문서도 적재되는지 검증")
    @Test
    void ingest_json() {
        StepVerifier.create(service.ingest("u1", "Streaming_History_Audio_2023.json",
                        ExportFixtures.utf8(ExportFixtures.EXTENDED_HISTORY), (s, p, m) -> { }))
                .assertNext(r -> assertThat(r.totalTracks()).isEqualTo(2L))
                .verifyComplete();
    }

    @DisplayName("업로드 범위 이전 데이터는 교체되고 그 이후의 동기화 데이터는 보존되는지 검증")
    @Test
    void ingest_keepsNewerSyncedEvents() {
        // given
        eventRepo.insertChunk("u1", List.of(
                new ListeningEvent("Stale", "Z", Instant.parse("2023-06-01T00:00:00Z"), 500, ListeningSource.BULK_EXPORT),
                new ListeningEvent("Fresh", "Y", Instant.parse("2024-02-01T00:00:00Z"), 700, ListeningSource.LIVE_SYNC)
        )).block();

        // when
        StepVerifier.create(service.ingest("u1", "export.zip",
                        ExportFixtures.zip("MyData/StreamingHistory_music_0.json", ExportFixtures.ACCOUNT_HISTORY),
                        (s, p, m) -> { }))
                .assertNext(r -> {
                    // then
                    assertThat(r.uploadedTracks()).isEqualTo(2L);
                    assertThat(r.totalTracks()).isEqualTo(3L);
                    assertThat(r.dateRangeEnd()).isEqualTo(Instant.parse("2024-02-01T00:00:00Z"));
                })
                .verifyComplete();

        StepVerifier.create(eventRepo.findAllByUser("u1", 100).map(ListeningEvent::trackName).collectList())
                .assertNext(names -> assertThat(names).containsExactlyInAnyOrder("Song 1", "Song 3", "Fresh"))
                .verifyComplete();
    }

    @DisplayName("재생 기록이 없는 아카이브는 추출 오류로 실패하는지 검증")
    @Test
    void ingest_noHistory_fails() {
        byte[] zip = ExportFixtures.zip("MyData/Userdata.json", "{\"username\":\"someone\"}");

        StepVerifier.create(service.ingest("u1", "export.zip", zip, (s, p, m) -> { }))
                .expectError(ExtractionException.class)
                .verify();
    }

    @DisplayName("저장 후 행이 조회되지 않으면 검증 오류로 실패하는지 검증")
    @Test
    void ingest_verificationFailure() {
        // given
        ListeningEventRepo repo = mock(ListeningEventRepo.class);
        when(repo.deleteByUserUpTo(anyString(), any())).thenReturn(Mono.just(0L));
        when(repo.insertChunk(anyString(), anyList())).thenAnswer(inv -> Mono.just((long) ((List<?>) inv.getArgument(1)).size()));
        when(repo.countByUser("u1")).thenReturn(Mono.just(0L));
        SummaryCalculator summary = mock(SummaryCalculator.class);
        ListeningAggregationService aggregation = mock(ListeningAggregationService.class);
        ListeningIngestService mocked = newService(repo, summary, aggregation);

        // when / then
        StepVerifier.create(mocked.ingest("u1", "export.zip",
                        ExportFixtures.zip("MyData/StreamingHistory_music_0.json", ExportFixtures.ACCOUNT_HISTORY),
                        (s, p, m) -> { }))
                .expectError(VerificationException.class)
                .verify();
        verifyNoInteractions(summary, aggregation);
    }

    @DisplayName("기존 데이터 정리가 실패해도 적재는 계속되는지 검증")
    @Test
    void ingest_purgeFailure_ignored() {
        // given
        ListeningEventRepo repo = mock(ListeningEventRepo.class);
        when(repo.deleteByUserUpTo(anyString(), any()))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("lock wait timeout")));
        when(repo.insertChunk(anyString(), anyList())).thenAnswer(inv -> Mono.just((long) ((List<?>) inv.getArgument(1)).size()));
        when(repo.countByUser("u1")).thenReturn(Mono.just(2L));
        SummaryCalculator summary = mock(SummaryCalculator.class);
        when(summary.recompute("u1")).thenReturn(Mono.just(
                new UserDataSummary(2, 2, 3000, null, null, NOW)));
        ListeningAggregationService aggregation = mock(ListeningAggregationService.class);
        when(aggregation.recomputeQuietly("u1")).thenReturn(Mono.just(false));
        ListeningIngestService mocked = newService(repo, summary, aggregation);

        // when / then
        StepVerifier.create(mocked.ingest("u1", "export.zip",
                        ExportFixtures.zip("MyData/StreamingHistory_music_0.json", ExportFixtures.ACCOUNT_HISTORY),
                        (s, p, m) -> { }))
                .assertNext(r -> assertThat(r.uploadedTracks()).isEqualTo(2L))
                .verifyComplete();
        verify(repo).insertChunk(eq("u1"), anyList());
    }

    @DisplayName("start가 job을 즉시 돌려주고 백그라운드 처리 후 completed 100이 되는지 검증")
    @Test
    void start_completesJob() {
        UploadJob job = service.start("u1", "export.zip",
                ExportFixtures.zip("MyData/StreamingHistory_music_0.json", ExportFixtures.ACCOUNT_HISTORY));

        assertThat(job.userId()).isEqualTo("u1");

        UploadJob done = awaitTerminal(job.id());
        assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.progress()).isEqualTo(100);
        assertThat(done.result().totalTracks()).isEqualTo(2L);
    }

    @DisplayName("zip 여부를 확장자로 판단하는지 검증")
    @Test
    void isArchive() {
        assertThat(ListeningIngestService.isArchive("export.ZIP")).isTrue();
        assertThat(ListeningIngestService.isArchive("history.json")).isFalse();
        assertThat(ListeningIngestService.isArchive(null)).isFalse();
    }

    private ListeningIngestService newService(ListeningEventRepo repo,
                                              SummaryCalculator summary,
                                              ListeningAggregationService aggregation) {
        return new ListeningIngestService(
                extractor, repo, new ListeningBatchWriter(repo, props), summary, aggregation,
                tracker, new DetachedJobRunner(tracker, Schedulers.immediate()));
    }

    private UploadJob awaitTerminal(String jobId) {
        return Mono.fromCallable(() -> tracker.find(jobId).orElseThrow())
                .filter(job -> job.status().isTerminal())
                .repeatWhenEmpty(500, attempts -> attempts.delayElements(Duration.ofMillis(10)))
                .block(Duration.ofSeconds(10));
    }
}
