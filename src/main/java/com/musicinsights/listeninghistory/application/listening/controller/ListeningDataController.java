package com.musicinsights.listeninghistory.application.listening.controller;

import com.musicinsights.listeninghistory.application.analytics.dto.response.PurgeResponse;
import com.musicinsights.listeninghistory.application.analytics.service.AnalyticsService;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * 사용자 청취 데이터 관리 API 컨트롤러.
 */
@RestController
@RequestMapping("/api/listening")
@Validated
public class ListeningDataController {
    private final AnalyticsService service;

    public ListeningDataController(AnalyticsService service) {
        this.service = service;
    }

    /**
     * 사용자의 청취 이벤트, 집계, 요약을 모두 삭제한다.
     *
     * @param userId 사용자 ID
     * @return 삭제 결과
     */
    @DeleteMapping("/data")
    public Mono<PurgeResponse> purge(@RequestHeader("X-User-Id") @NotBlank String userId) {
        return service.purge(userId);
    }
}
