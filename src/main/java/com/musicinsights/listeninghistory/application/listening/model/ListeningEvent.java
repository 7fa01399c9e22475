package com.musicinsights.listeninghistory.application.listening.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 한 번의 재생을 나타내는 정규화된 청취 이벤트.
 *
 * <p>생성 후 변경되지 않으며, 저장소에서도 갱신 없이 추가/일괄 삭제만 일어난다.</p>
 *
 * @param trackName  곡 제목
 * @param artistName 아티스트명(출처에 따라 여러 아티스트를 합친 문자열일 수 있음)
 * @param playedAt   재생 시각
 * @param durationMs 재생 시간(ms, 0 이상)
 * @param source     이벤트 출처
 */
public record ListeningEvent(
        String trackName,
        String artistName,
        Instant playedAt,
        long durationMs,
        ListeningSource source
) {
    public ListeningEvent {
        Objects.requireNonNull(trackName, "trackName");
        Objects.requireNonNull(artistName, "artistName");
        Objects.requireNonNull(playedAt, "playedAt");
        Objects.requireNonNull(source, "source");
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be >= 0: " + durationMs);
        }
    }

    /**
     * 중복 판단에 사용하는 자연키를 반환한다.
     *
     * @return (trackName, artistName, playedAt)
     */
    public NaturalKey naturalKey() {
        return new NaturalKey(trackName, artistName, playedAt);
    }
}
