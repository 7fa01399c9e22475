package com.musicinsights.listeninghistory.application.analytics.controller;

import com.musicinsights.listeninghistory.application.aggregation.dto.AggregationKind;
import com.musicinsights.listeninghistory.application.aggregation.dto.Grouping;
import com.musicinsights.listeninghistory.application.analytics.dto.response.AggregationResponse;
import com.musicinsights.listeninghistory.application.analytics.dto.response.RecomputeResponse;
import com.musicinsights.listeninghistory.application.analytics.dto.response.SummaryResponse;
import com.musicinsights.listeninghistory.application.analytics.service.AnalyticsService;
import com.musicinsights.listeninghistory.application.common.error.BadRequestException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * 청취 분석 조회 API 컨트롤러.
 *
 * <p>사용자 요약과 미리 계산된 집계(날짜 빈도, 시간대, 요일, Top 트랙/아티스트)를 제공한다.</p>
 */
@RestController
@RequestMapping("/api/analytics")
@Validated
public class AnalyticsController {
    private final AnalyticsService service;

    public AnalyticsController(AnalyticsService service) {
        this.service = service;
    }

    /**
     * 사용자 요약을 조회한다.
     *
     * @param userId 사용자 ID
     * @return 요약 응답
     */
    @GetMapping("/summary")
    public Mono<SummaryResponse> summary(@RequestHeader("X-User-Id") @NotBlank String userId) {
        return service.summary(userId);
    }

    /**
     * 저장된 집계를 조회한다.
     *
     * @param userId  사용자 ID
     * @param kind    집계 종류(date-frequency, time-of-day, day-of-week, top-tracks, top-artists)
     * @param groupBy 날짜 단위(day, month, year). 날짜 빈도에서만 사용
     * @param limit   Top 목록 개수
     * @return 집계 응답
     */
    @GetMapping("/aggregations/{kind}")
    public Mono<AggregationResponse> aggregation(
            @RequestHeader("X-User-Id") @NotBlank String userId,
            @PathVariable String kind,
            @RequestParam(defaultValue = "day") String groupBy,
            @RequestParam(defaultValue = "10") @Min(1) @Max(50) int limit
    ) {
        AggregationKind aggregationKind = AggregationKind.fromValue(kind)
                .orElseThrow(() -> new BadRequestException("Unknown aggregation kind: " + kind, "INVALID_KIND"));
        Grouping grouping = Grouping.fromValue(groupBy)
                .orElseThrow(() -> new BadRequestException("Unknown groupBy: " + groupBy, "INVALID_GROUP_BY"));

        return service.aggregation(userId, aggregationKind, grouping, limit);
    }

    /**
     * 요약과 집계를 즉시 다시 계산한다.
     *
     * @param userId 사용자 ID
     * @return 재계산 결과
     */
    @PostMapping("/recompute")
    public Mono<RecomputeResponse> recompute(@RequestHeader("X-User-Id") @NotBlank String userId) {
        return service.recompute(userId);
    }
}
