package com.musicinsights.listeninghistory.infrastructure.input.spotify;

import com.musicinsights.listeninghistory.infrastructure.input.spotify.dto.PlayHistoryItem;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * 외부 스트리밍 서비스의 "최근 재생" 목록 공급원.
 */
public interface RecentlyPlayedSource {

    /**
     * 기준 시각보다 나중에 재생된 항목을 최신순으로 가져온다.
     *
     * @param accessToken 사용자 접근 토큰(불투명 문자열)
     * @param after       기준 시각(이 시각보다 나중인 항목만, null이면 제한 없음)
     * @param maxTracks   최대 항목 수
     * @return 재생 항목(최신순)
     */
    Flux<PlayHistoryItem> fetchSince(String accessToken, Instant after, int maxTracks);
}
