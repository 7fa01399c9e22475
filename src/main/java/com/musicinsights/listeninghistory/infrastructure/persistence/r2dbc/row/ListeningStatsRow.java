package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row;

import java.time.Instant;

/**
 * 사용자 청취 이벤트에 대한 저장소 측 집계(COUNT/MIN/MAX) 결과입니다.
 *
 * @param totalTracks          전체 이벤트 수
 * @param totalArtists         서로 다른 아티스트 수
 * @param totalListeningTimeMs 총 재생 시간(ms)
 * @param firstPlayedAt        가장 이른 재생 시각(이벤트가 없으면 null)
 * @param lastPlayedAt         가장 늦은 재생 시각(이벤트가 없으면 null)
 */
public record ListeningStatsRow(
        long totalTracks,
        long totalArtists,
        long totalListeningTimeMs,
        Instant firstPlayedAt,
        Instant lastPlayedAt
) {}
