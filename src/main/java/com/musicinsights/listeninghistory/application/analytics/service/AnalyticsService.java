package com.musicinsights.listeninghistory.application.analytics.service;

import com.musicinsights.listeninghistory.application.aggregation.dto.AggregationKind;
import com.musicinsights.listeninghistory.application.aggregation.dto.Grouping;
import com.musicinsights.listeninghistory.application.aggregation.dto.HourPattern;
import com.musicinsights.listeninghistory.application.aggregation.service.ListeningAggregationService;
import com.musicinsights.listeninghistory.application.analytics.dto.response.AggregationResponse;
import com.musicinsights.listeninghistory.application.analytics.dto.response.PurgeResponse;
import com.musicinsights.listeninghistory.application.analytics.dto.response.RecomputeResponse;
import com.musicinsights.listeninghistory.application.analytics.dto.response.SummaryResponse;
import com.musicinsights.listeninghistory.application.summary.service.SummaryCalculator;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.ListeningEventRepo;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.UserDataSummaryRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 분석 화면용 조회/재계산/삭제 서비스.
 *
 * <p>조회는 미리 저장된 요약과 집계만 읽으며, 요청 시점에 원본 이벤트를 다시 집계하지 않는다.</p>
 */
@Service
public class AnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    private final SummaryCalculator summaryCalculator;
    private final ListeningAggregationService aggregationService;
    private final ListeningEventRepo eventRepo;
    private final UserDataSummaryRepo summaryRepo;
    private final TransactionalOperator tx;

    public AnalyticsService(SummaryCalculator summaryCalculator,
                            ListeningAggregationService aggregationService,
                            ListeningEventRepo eventRepo,
                            UserDataSummaryRepo summaryRepo,
                            TransactionalOperator tx) {
        this.summaryCalculator = summaryCalculator;
        this.aggregationService = aggregationService;
        this.eventRepo = eventRepo;
        this.summaryRepo = summaryRepo;
        this.tx = tx;
    }

    /**
     * 저장된 요약을 조회한다.
     *
     * @param userId 사용자 ID
     * @return 요약 응답(데이터가 없거나 읽을 수 없으면 summary=null, totalCount=0)
     */
    public Mono<SummaryResponse> summary(String userId) {
        return summaryCalculator.find(userId)
                .map(SummaryResponse::of)
                .defaultIfEmpty(SummaryResponse.empty())
                .onErrorResume(e -> {
                    log.warn("Summary read failed for user {}, returning empty: {}", userId, e.getMessage());
                    return Mono.just(SummaryResponse.empty());
                });
    }

    /**
     * 저장된 집계를 조회한다. Top 목록은 limit 개수로 자른다.
     *
     * @param userId   사용자 ID
     * @param kind     집계 종류
     * @param grouping 날짜 단위
     * @param limit    Top 목록 개수
     * @return 집계 응답(계산 전이거나 저장소를 읽을 수 없으면 computed=false)
     */
    public Mono<AggregationResponse> aggregation(String userId, AggregationKind kind, Grouping grouping, int limit) {
        Grouping effective = kind == AggregationKind.DATE_FREQUENCY ? grouping : null;
        return aggregationService.find(userId, kind, grouping)
                .map(stored -> new AggregationResponse(
                        kind,
                        stored.grouping(),
                        true,
                        stored.computedAt(),
                        kind.isTopList() ? slice(stored.items(), limit) : stored.items()
                ))
                .defaultIfEmpty(AggregationResponse.notComputed(kind, effective))
                .onErrorResume(e -> {
                    log.warn("Aggregation read failed for user {} ({}), returning not computed: {}",
                            userId, kind.value(), e.getMessage());
                    return Mono.just(AggregationResponse.notComputed(kind, effective));
                });
    }

    /**
     * 요약과 집계를 즉시 다시 계산한다. 집계 저장 실패는 에러로 전파한다.
     *
     * @param userId 사용자 ID
     * @return 재계산 결과
     */
    public Mono<RecomputeResponse> recompute(String userId) {
        return summaryCalculator.recompute(userId)
                .flatMap(summary -> aggregationService.recompute(userId)
                        .map(set -> new RecomputeResponse(
                                summary,
                                set.timeOfDay().stream().mapToLong(HourPattern::playCount).sum()
                        )));
    }

    /**
     * 사용자의 이벤트, 집계, 요약을 한 트랜잭션에서 모두 삭제한다.
     *
     * @param userId 사용자 ID
     * @return 삭제 결과
     */
    public Mono<PurgeResponse> purge(String userId) {
        Mono<PurgeResponse> deletes = eventRepo.deleteByUser(userId)
                .flatMap(events -> aggregationService.deleteAll(userId)
                        .flatMap(aggs -> summaryRepo.deleteByUser(userId)
                                .map(summaries -> new PurgeResponse(events, aggs, summaries > 0))));

        return tx.transactional(deletes)
                .doOnNext(r -> log.info("Purged listening data for user {}: events={}, aggregations={}",
                        userId, r.deletedEvents(), r.deletedAggregations()));
    }

    private static List<?> slice(List<?> items, int limit) {
        return items.size() <= limit ? items : items.subList(0, limit);
    }
}
