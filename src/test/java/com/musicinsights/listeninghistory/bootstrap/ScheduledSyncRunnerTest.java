package com.musicinsights.listeninghistory.bootstrap;

import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.application.job.JobProgress;
import com.musicinsights.listeninghistory.application.summary.dto.UserDataSummary;
import com.musicinsights.listeninghistory.application.sync.service.ListeningSyncService;
import com.musicinsights.listeninghistory.application.sync.service.SyncResult;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.UserSyncTokenRepo;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row.SyncTokenRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * {@link ScheduledSyncRunner} 단위 테스트.
 *
 * <p>저장된 토큰의 사용자를 순서대로 동기화하고, 한 사용자의 실패가 다른 사용자 동기화를 막지 않는지 검증한다.</p>
 */
@DisplayName("주기 동기화 테스트")
class ScheduledSyncRunnerTest {

    private final UserSyncTokenRepo tokenRepo = mock(UserSyncTokenRepo.class);
    private final ListeningSyncService syncService = mock(ListeningSyncService.class);

    private ScheduledSyncRunner runner() {
        ListeningPipelineProperties props = new ListeningPipelineProperties();
        props.getSync().setUserDelay(Duration.ofMillis(1));
        return new ScheduledSyncRunner(tokenRepo, syncService, props);
    }

    @Test
    @DisplayName("한 사용자가 실패해도 나머지 사용자를 순서대로 동기화하고 결과를 합산하는지 검증")
    void syncAll_continuesAfterFailure() {
        // given
        when(tokenRepo.findAll()).thenReturn(Flux.just(
                new SyncTokenRow("u1", "t1"),
                new SyncTokenRow("u2", "expired"),
                new SyncTokenRow("u3", "t3")));
        when(syncService.sync(eq("u1"), eq("t1"), any())).thenReturn(Mono.just(result(4)));
        when(syncService.sync(eq("u2"), eq("expired"), any()))
                .thenReturn(Mono.error(new IllegalStateException("401 Unauthorized")));
        when(syncService.sync(eq("u3"), eq("t3"), any())).thenReturn(Mono.just(result(1)));

        // when / then
        StepVerifier.create(runner().syncAll())
                .assertNext(summary -> {
                    assertThat(summary.users()).isEqualTo(3);
                    assertThat(summary.succeeded()).isEqualTo(2);
                    assertThat(summary.newTracks()).isEqualTo(5L);
                })
                .verifyComplete();

        InOrder inOrder = inOrder(syncService);
        inOrder.verify(syncService).sync("u1", "t1", JobProgress.NONE);
        inOrder.verify(syncService).sync("u2", "expired", JobProgress.NONE);
        inOrder.verify(syncService).sync("u3", "t3", JobProgress.NONE);
    }

    @Test
    @DisplayName("저장된 토큰이 없으면 빈 결과로 끝나는지 검증")
    void syncAll_noUsers() {
        when(tokenRepo.findAll()).thenReturn(Flux.empty());

        StepVerifier.create(runner().syncAll())
                .assertNext(summary -> assertThat(summary.users()).isZero())
                .verifyComplete();

        verifyNoInteractions(syncService);
    }

    private static SyncResult result(long newTracks) {
        return new SyncResult(newTracks, newTracks,
                new UserDataSummary(newTracks, 1, 1000, null, null, Instant.EPOCH));
    }
}
