package com.musicinsights.listeninghistory.application.aggregation.dto;

/**
 * 요일별 재생 수.
 *
 * @param day       요일(0=일요일 ~ 6=토요일)
 * @param dayName   요일 이름(Sunday ~ Saturday)
 * @param playCount 재생 수
 */
public record DayPattern(int day, String dayName, long playCount) {
}
