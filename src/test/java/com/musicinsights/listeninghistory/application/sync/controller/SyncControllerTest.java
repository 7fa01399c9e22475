package com.musicinsights.listeninghistory.application.sync.controller;

import com.musicinsights.listeninghistory.application.job.UploadJob;
import com.musicinsights.listeninghistory.application.sync.service.ListeningSyncService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webflux.test.autoconfigure.WebFluxTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * {@link SyncController} WebFlux 슬라이스 테스트.
 */
@WebFluxTest(controllers = SyncController.class)
@DisplayName("sync controller 테스트")
class SyncControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockitoBean
    ListeningSyncService syncService;

    @Test
    @DisplayName("Bearer 토큰을 떼어 서비스로 전달하고 job ID를 반환하는지 검증")
    void sync_ok() {
        // given
        when(syncService.start("u1", "abc"))
                .thenReturn(Mono.just(UploadJob.pending("u1-1", "u1", "Upload queued", Instant.EPOCH)));

        // when / then
        webTestClient.post()
                .uri("/api/sync/recently-played")
                .header("X-User-Id", "u1")
                .header(HttpHeaders.AUTHORIZATION, "Bearer abc")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo("u1-1")
                .jsonPath("$.message").isEqualTo("Sync started. Processing in background...");

        Mockito.verify(syncService).start("u1", "abc");
    }

    @Test
    @DisplayName("토큰이 없으면 400 MISSING_TOKEN으로 거절되는지 검증")
    void sync_missingToken() {
        webTestClient.post()
                .uri("/api/sync/recently-played")
                .header("X-User-Id", "u1")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("MISSING_TOKEN");

        Mockito.verifyNoInteractions(syncService);
    }

    @Test
    @DisplayName("Authorization 헤더에서 Bearer 토큰만 추출하는지 검증")
    void bearerToken() {
        assertThat(SyncController.bearerToken("Bearer  abc ")).isEqualTo("abc");
        assertThat(SyncController.bearerToken("Basic abc")).isNull();
        assertThat(SyncController.bearerToken("Bearer ")).isNull();
        assertThat(SyncController.bearerToken(null)).isNull();
    }
}
