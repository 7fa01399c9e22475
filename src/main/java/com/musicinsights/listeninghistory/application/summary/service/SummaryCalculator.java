package com.musicinsights.listeninghistory.application.summary.service;

import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import com.musicinsights.listeninghistory.application.summary.dto.UserDataSummary;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.ListeningEventRepo;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.UserDataSummaryRepo;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row.ListeningStatsRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * 사용자 요약(총 재생 수, 아티스트 수, 총 재생 시간, 기간) 계산기.
 *
 * <p>전체 이벤트를 다시 읽지 않도록 저장소 측 COUNT/MIN/MAX 조회를 우선 사용하고,
 * 해당 조회를 쓸 수 없을 때만 전체 이벤트를 메모리에서 집계한다.</p>
 */
@Service
public class SummaryCalculator {

    private static final Logger log = LoggerFactory.getLogger(SummaryCalculator.class);

    private final ListeningEventRepo eventRepo;
    private final UserDataSummaryRepo summaryRepo;
    private final Clock clock;
    private final int pageSize;

    public SummaryCalculator(ListeningEventRepo eventRepo,
                             UserDataSummaryRepo summaryRepo,
                             Clock clock,
                             ListeningPipelineProperties props) {
        this.eventRepo = eventRepo;
        this.summaryRepo = summaryRepo;
        this.clock = clock;
        this.pageSize = props.getBatch().getPageSize();
    }

    /**
     * 요약을 계산한다(저장하지 않음).
     *
     * @param userId 사용자 ID
     * @return 계산된 요약
     */
    public Mono<UserDataSummary> calculate(String userId) {
        Instant now = clock.instant();
        return eventRepo.summarize(userId)
                .onErrorResume(e -> {
                    log.warn("Store-side summary query failed for user {}, falling back to full scan: {}",
                            userId, e.getMessage());
                    return reduce(eventRepo.findAllByUser(userId, pageSize));
                })
                .map(stats -> UserDataSummary.of(stats, now));
    }

    /**
     * 요약을 계산하여 사용자 키 기준으로 교체 저장한다.
     *
     * @param userId 사용자 ID
     * @return 저장된 요약
     */
    public Mono<UserDataSummary> recompute(String userId) {
        return calculate(userId)
                .flatMap(summary -> summaryRepo.upsert(summary.toRow(userId)).thenReturn(summary));
    }

    /**
     * 저장된 요약을 조회한다.
     *
     * @param userId 사용자 ID
     * @return 요약(저장된 적이 없으면 empty)
     */
    public Mono<UserDataSummary> find(String userId) {
        return summaryRepo.findByUser(userId).map(UserDataSummary::from);
    }

    /**
     * 이벤트 전체를 메모리에서 집계한다.
     *
     * @param events 이벤트 스트림
     * @return 집계 결과
     */
    public static Mono<ListeningStatsRow> reduce(Flux<ListeningEvent> events) {
        return events.reduceWith(Accumulator::new, Accumulator::add).map(Accumulator::toStats);
    }

    private static final class Accumulator {
        private long count;
        private long totalMs;
        private Instant first;
        private Instant last;
        private final Set<String> artists = new HashSet<>();

        Accumulator add(ListeningEvent e) {
            count++;
            totalMs += e.durationMs();
            artists.add(e.artistName());
            if (first == null || e.playedAt().isBefore(first)) first = e.playedAt();
            if (last == null || e.playedAt().isAfter(last)) last = e.playedAt();
            return this;
        }

        ListeningStatsRow toStats() {
            return new ListeningStatsRow(count, artists.size(), totalMs, first, last);
        }
    }
}
