package com.musicinsights.listeninghistory.application.aggregation.dto;

/**
 * 많이 들은 아티스트.
 *
 * @param artistName      아티스트명
 * @param playCount       재생 수
 * @param totalDurationMs 총 재생 시간(ms)
 */
public record TopArtist(String artistName, long playCount, long totalDurationMs) {
}
