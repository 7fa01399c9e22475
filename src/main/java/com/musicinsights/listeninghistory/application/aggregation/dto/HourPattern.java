package com.musicinsights.listeninghistory.application.aggregation.dto;

/**
 * 시간대(0~23시)별 재생 수.
 *
 * @param hour      시(0~23)
 * @param playCount 재생 수
 */
public record HourPattern(int hour, long playCount) {
}
