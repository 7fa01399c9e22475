package com.musicinsights.listeninghistory.application.listening.controller;

import com.musicinsights.listeninghistory.application.analytics.dto.response.PurgeResponse;
import com.musicinsights.listeninghistory.application.analytics.service.AnalyticsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webflux.test.autoconfigure.WebFluxTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.Mockito.when;

/**
 * {@link ListeningDataController} WebFlux 슬라이스 테스트.
 */
@WebFluxTest(controllers = ListeningDataController.class)
@DisplayName("listening data controller 테스트")
class ListeningDataControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockitoBean
    AnalyticsService service;

    @Test
    @DisplayName("삭제 요청 시 사용자 데이터 삭제 결과가 반환되는지 검증")
    void purge_ok() {
        when(service.purge("u1")).thenReturn(Mono.just(new PurgeResponse(3, 7, true)));

        webTestClient.delete()
                .uri("/api/listening/data")
                .header("X-User-Id", "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deletedEvents").isEqualTo(3)
                .jsonPath("$.deletedAggregations").isEqualTo(7)
                .jsonPath("$.summaryDeleted").isEqualTo(true);

        Mockito.verify(service).purge("u1");
    }

    @Test
    @DisplayName("DB 오류는 500 DB_ERROR로 매핑되는지 검증")
    void purge_dbError() {
        when(service.purge("u1")).thenReturn(Mono.error(new DataAccessResourceFailureException("down")));

        webTestClient.delete()
                .uri("/api/listening/data")
                .header("X-User-Id", "u1")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.code").isEqualTo("DB_ERROR");
    }
}
