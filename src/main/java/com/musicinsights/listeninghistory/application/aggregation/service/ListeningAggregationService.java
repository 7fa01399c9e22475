package com.musicinsights.listeninghistory.application.aggregation.service;

import com.musicinsights.listeninghistory.application.aggregation.dto.AggregationKind;
import com.musicinsights.listeninghistory.application.aggregation.dto.AggregationSet;
import com.musicinsights.listeninghistory.application.aggregation.dto.DateFrequency;
import com.musicinsights.listeninghistory.application.aggregation.dto.DayPattern;
import com.musicinsights.listeninghistory.application.aggregation.dto.Grouping;
import com.musicinsights.listeninghistory.application.aggregation.dto.HourPattern;
import com.musicinsights.listeninghistory.application.aggregation.dto.StoredAggregation;
import com.musicinsights.listeninghistory.application.aggregation.dto.TopArtist;
import com.musicinsights.listeninghistory.application.aggregation.dto.TopTrack;
import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.application.common.error.AggregationStorageException;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.ListeningAggregationRepo;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.ListeningEventRepo;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row.AggregationRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 집계 재계산/저장/조회 서비스.
 *
 * <p>재계산은 항상 전체 기록 기준이며, 사용자의 기존 집계 행을 모두 삭제한 뒤 새 결과를 삽입한다.
 * 두 단계를 하나의 트랜잭션으로 묶어 읽는 쪽이 옛 결과와 새 결과가 섞인 상태를 보지 않게 한다.</p>
 */
@Service
public class ListeningAggregationService {

    private static final Logger log = LoggerFactory.getLogger(ListeningAggregationService.class);

    private final ListeningEventRepo eventRepo;
    private final ListeningAggregationRepo aggregationRepo;
    private final AggregationEngine engine;
    private final ObjectMapper mapper;
    private final TransactionalOperator tx;
    private final Clock clock;
    private final int pageSize;

    public ListeningAggregationService(ListeningEventRepo eventRepo,
                                       ListeningAggregationRepo aggregationRepo,
                                       AggregationEngine engine,
                                       ObjectMapper mapper,
                                       TransactionalOperator tx,
                                       Clock clock,
                                       ListeningPipelineProperties props) {
        this.eventRepo = eventRepo;
        this.aggregationRepo = aggregationRepo;
        this.engine = engine;
        this.mapper = mapper;
        this.tx = tx;
        this.clock = clock;
        this.pageSize = props.getBatch().getPageSize();
    }

    /**
     * 사용자 전체 기록으로 집계를 다시 계산하여 교체 저장한다.
     *
     * @param userId 사용자 ID
     * @return 계산된 집계
     * @throws AggregationStorageException 집계 저장 실패 시(에러 시그널)
     */
    public Mono<AggregationSet> recompute(String userId) {
        return eventRepo.findAllByUser(userId, pageSize)
                .collectList()
                .map(engine::compute)
                .flatMap(set -> store(userId, set).thenReturn(set));
    }

    /**
     * 집계를 다시 계산하되 실패해도 에러를 전파하지 않는다.
     *
     * <p>적재 성공 여부는 집계 성공 여부와 무관하므로 업로드/동기화 파이프라인에서 사용한다.</p>
     *
     * @param userId 사용자 ID
     * @return 성공 여부
     */
    public Mono<Boolean> recomputeQuietly(String userId) {
        return recompute(userId)
                .map(set -> true)
                .onErrorResume(e -> {
                    log.warn("Aggregation recompute failed for user {} (ignored): {}", userId, e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * 저장된 집계 하나를 조회한다.
     *
     * @param userId   사용자 ID
     * @param kind     집계 종류
     * @param grouping 날짜 단위(날짜 빈도에서만 사용, 그 외에는 무시)
     * @return 저장된 집계(계산된 적이 없으면 empty)
     */
    public Mono<StoredAggregation> find(String userId, AggregationKind kind, Grouping grouping) {
        Grouping effective = kind == AggregationKind.DATE_FREQUENCY ? grouping : null;
        return aggregationRepo.find(userId, kind.value(), effective == null ? null : effective.value())
                .map(row -> new StoredAggregation(kind, effective, readItems(kind, row.payload()), row.computedAt()));
    }

    /**
     * 사용자의 집계 행을 모두 삭제한다.
     *
     * @param userId 사용자 ID
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteAll(String userId) {
        return aggregationRepo.deleteByUser(userId);
    }

    private Mono<Long> store(String userId, AggregationSet set) {
        return Mono.fromCallable(() -> toRows(set, clock.instant()))
                .flatMap(rows -> tx.transactional(
                        aggregationRepo.deleteByUser(userId)
                                .then(aggregationRepo.insertAll(userId, rows))
                ))
                .doOnNext(n -> log.info("Stored {} aggregation rows for user {}", n, userId))
                .onErrorMap(e -> !(e instanceof AggregationStorageException),
                        e -> new AggregationStorageException(userId, e));
    }

    private List<AggregationRow> toRows(AggregationSet set, Instant now) {
        List<AggregationRow> rows = new ArrayList<>();
        set.dateFrequency().forEach((grouping, items) ->
                rows.add(row(AggregationKind.DATE_FREQUENCY, grouping, items, now)));
        rows.add(row(AggregationKind.TIME_OF_DAY, null, set.timeOfDay(), now));
        rows.add(row(AggregationKind.DAY_OF_WEEK, null, set.dayOfWeek(), now));
        rows.add(row(AggregationKind.TOP_TRACKS, null, set.topTracks(), now));
        rows.add(row(AggregationKind.TOP_ARTISTS, null, set.topArtists(), now));
        return rows;
    }

    private AggregationRow row(AggregationKind kind, Grouping grouping, List<?> items, Instant now) {
        return new AggregationRow(
                kind.value(),
                grouping == null ? null : grouping.value(),
                mapper.writeValueAsString(items),
                now
        );
    }

    private List<?> readItems(AggregationKind kind, String payload) {
        JavaType type = mapper.getTypeFactory().constructCollectionType(List.class, itemType(kind));
        return mapper.readValue(payload, type);
    }

    private static Class<?> itemType(AggregationKind kind) {
        switch (kind) {
            case DATE_FREQUENCY:
                return DateFrequency.class;
            case TIME_OF_DAY:
                return HourPattern.class;
            case DAY_OF_WEEK:
                return DayPattern.class;
            case TOP_TRACKS:
                return TopTrack.class;
            default:
                return TopArtist.class;
        }
    }
}
