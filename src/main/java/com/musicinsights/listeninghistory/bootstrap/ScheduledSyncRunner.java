package com.musicinsights.listeninghistory.bootstrap;

import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.application.job.JobProgress;
import com.musicinsights.listeninghistory.application.sync.service.ListeningSyncService;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.UserSyncTokenRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * 저장된 토큰을 가진 모든 사용자의 최근 재생 기록을 주기적으로 동기화한다.
 *
 * <p>{@code listening.sync.schedule.enabled=true}일 때만 활성화된다.
 * 외부 API rate limit 때문에 사용자를 순차 처리하며 사용자 사이에 대기 시간을 둔다.
 * 한 사용자의 실패는 로그만 남기고 다음 사용자로 넘어간다.</p>
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "listening.sync.schedule", name = "enabled", havingValue = "true")
public class ScheduledSyncRunner {

    private static final Logger log = LoggerFactory.getLogger(ScheduledSyncRunner.class);

    private final UserSyncTokenRepo tokenRepo;
    private final ListeningSyncService syncService;
    private final Duration userDelay;

    public ScheduledSyncRunner(UserSyncTokenRepo tokenRepo,
                               ListeningSyncService syncService,
                               ListeningPipelineProperties props) {
        this.tokenRepo = tokenRepo;
        this.syncService = syncService;
        this.userDelay = props.getSync().getUserDelay();
    }

    @Scheduled(cron = "${listening.sync.schedule.cron:0 0 * * * *}")
    public void run() {
        SyncRunSummary summary = syncAll().block();
        if (summary != null) {
            log.info("Scheduled sync done. users={}, succeeded={}, newTracks={}",
                    summary.users(), summary.succeeded(), summary.newTracks());
        }
    }

    /**
     * 모든 사용자를 순차 동기화한다.
     *
     * @return 실행 요약
     */
    public Mono<SyncRunSummary> syncAll() {
        return tokenRepo.findAll()
                .index()
                .concatMap(t -> {
                    Mono<Long> delay = t.getT1() == 0 ? Mono.just(0L) : Mono.delay(userDelay);
                    String userId = t.getT2().userId();
                    return delay.then(Mono.defer(() -> syncService.sync(userId, t.getT2().accessToken(), JobProgress.NONE)))
                            .map(r -> new SyncRunSummary(1, 1, r.newTracksCount()))
                            .onErrorResume(e -> {
                                log.warn("Scheduled sync failed for user {}: {}", userId, e.getMessage());
                                return Mono.just(new SyncRunSummary(1, 0, 0));
                            });
                })
                .reduce(new SyncRunSummary(0, 0, 0), SyncRunSummary::plus);
    }

    /**
     * 주기 동기화 실행 결과.
     *
     * @param users     처리한 사용자 수
     * @param succeeded 성공한 사용자 수
     * @param newTracks 새로 저장된 이벤트 수 합계
     */
    public record SyncRunSummary(int users, int succeeded, long newTracks) {
        SyncRunSummary plus(SyncRunSummary other) {
            return new SyncRunSummary(users + other.users, succeeded + other.succeeded, newTracks + other.newTracks);
        }
    }
}
