package com.musicinsights.listeninghistory.application.listening.model;

import java.time.Instant;

/**
 * 청취 이벤트의 자연키 (trackName, artistName, playedAt).
 *
 * <p>문자열과 시각의 정확한 일치로만 비교한다. 대소문자/공백 보정은 하지 않는다.</p>
 *
 * @param trackName  곡 제목
 * @param artistName 아티스트명
 * @param playedAt   재생 시각
 */
public record NaturalKey(String trackName, String artistName, Instant playedAt) {
}
