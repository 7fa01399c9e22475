package com.musicinsights.listeninghistory.application.aggregation.dto;

import java.util.List;
import java.util.Map;

/**
 * 한 사용자의 전체 기록으로 계산한 집계 결과 묶음.
 *
 * @param dateFrequency 날짜 단위별 빈도(오름차순)
 * @param timeOfDay     24개 시간대
 * @param dayOfWeek     7개 요일
 * @param topTracks     Top 트랙(재생 수 내림차순)
 * @param topArtists    Top 아티스트(재생 수 내림차순)
 */
public record AggregationSet(
        Map<Grouping, List<DateFrequency>> dateFrequency,
        List<HourPattern> timeOfDay,
        List<DayPattern> dayOfWeek,
        List<TopTrack> topTracks,
        List<TopArtist> topArtists
) {
}
