package com.musicinsights.listeninghistory.application.aggregation.dto;

import java.time.LocalDate;

/**
 * 날짜 구간별 재생 빈도.
 *
 * @param period          구간 키(day: yyyy-MM-dd, month: yyyy-MM, year: yyyy)
 * @param periodStart     구간 시작일
 * @param playCount       재생 수
 * @param totalDurationMs 총 재생 시간(ms)
 */
public record DateFrequency(String period, LocalDate periodStart, long playCount, long totalDurationMs) {
}
