package com.musicinsights.listeninghistory.infrastructure.input.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 최근 재생 응답의 아티스트 항목.
 *
 * @param id   아티스트 ID
 * @param name 아티스트명
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtistObject(String id, String name) {
}
