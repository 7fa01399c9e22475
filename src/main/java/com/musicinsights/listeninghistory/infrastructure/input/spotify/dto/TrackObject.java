package com.musicinsights.listeninghistory.infrastructure.input.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 최근 재생 응답의 트랙 항목.
 *
 * @param id         트랙 ID
 * @param name       곡 제목
 * @param durationMs 곡 길이(ms)
 * @param artists    참여 아티스트(표기 순서 유지)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackObject(
        String id,
        String name,
        @JsonProperty("duration_ms") Long durationMs,
        List<ArtistObject> artists
) {
}
