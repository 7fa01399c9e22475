package com.musicinsights.listeninghistory.infrastructure.input.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 최근 재생 목록의 한 항목.
 *
 * @param track    재생된 트랙
 * @param playedAt 재생 시각(ISO-8601)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayHistoryItem(
        TrackObject track,
        @JsonProperty("played_at") String playedAt
) {
}
