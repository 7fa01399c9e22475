package com.musicinsights.listeninghistory.infrastructure.mapper;

import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import com.musicinsights.listeninghistory.application.listening.model.ListeningSource;
import com.musicinsights.listeninghistory.infrastructure.input.export.NormalizeUtils;
import com.musicinsights.listeninghistory.infrastructure.input.export.StreamingHistoryRaw;
import com.musicinsights.listeninghistory.infrastructure.input.spotify.dto.ArtistObject;
import com.musicinsights.listeninghistory.infrastructure.input.spotify.dto.PlayHistoryItem;
import com.musicinsights.listeninghistory.infrastructure.input.spotify.dto.TrackObject;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 출처가 다른 원본 청취 기록을 하나의 {@link ListeningEvent} 형태로 변환하는 매퍼입니다.
 * <p>
 * 다음 항목은 오류가 아니라 "제외"로 처리합니다.
 * <ul>
 *     <li>재생 시간이 0ms인 항목(건너뛰기/부분 재생)</li>
 *     <li>곡 제목이 없는 항목(팟캐스트 에피소드, 오디오북 등)</li>
 *     <li>재생 시각을 해석할 수 없는 항목</li>
 * </ul>
 */
@Component
public class ListeningEventNormalizer {

    /**
     * 내보내기 항목 하나를 정규화합니다.
     * <p>
     * 내보내기의 시각 값은 "재생이 끝난 시각"이며, 시작 시각을 역산하지 않고 그대로 사용합니다.
     *
     * @param raw 내보내기 원본 항목
     * @return 정규화된 이벤트, 제외 대상이면 empty
     */
    public Optional<ListeningEvent> fromExport(StreamingHistoryRaw raw) {
        if (raw == null) return Optional.empty();

        String track = NormalizeUtils.firstNonBlank(raw.trackName, raw.masterTrackName);
        if (track == null) return Optional.empty();

        long ms = firstPositive(raw.msPlayed, raw.msPlayedExtended);
        if (ms <= 0) return Optional.empty();

        Instant playedAt = NormalizeUtils.parseInstantOrNull(
                NormalizeUtils.firstNonBlank(raw.endTime, raw.ts, raw.playedAt));
        if (playedAt == null) return Optional.empty();

        String artist = NormalizeUtils.firstNonBlank(raw.artistName, raw.masterArtistName);
        return Optional.of(new ListeningEvent(
                track,
                artist == null ? "" : artist,
                playedAt,
                ms,
                ListeningSource.BULK_EXPORT
        ));
    }

    /**
     * 내보내기 항목 목록을 정규화합니다. 제외 대상은 결과에서 빠집니다.
     *
     * @param raws 내보내기 원본 항목 목록
     * @return 정규화된 이벤트 목록(입력 순서 유지)
     */
    public List<ListeningEvent> fromExport(List<StreamingHistoryRaw> raws) {
        List<ListeningEvent> out = new ArrayList<>(raws.size());
        for (StreamingHistoryRaw raw : raws) {
            fromExport(raw).ifPresent(out::add);
        }
        return out;
    }

    /**
     * 최근 재생 항목 하나를 정규화합니다.
     *
     * @param item 최근 재생 항목
     * @param mode 여러 아티스트 처리 방식
     * @return 정규화된 이벤트, 제외 대상이면 empty
     */
    public Optional<ListeningEvent> fromRecentlyPlayed(PlayHistoryItem item, ArtistNameMode mode) {
        if (item == null || item.track() == null) return Optional.empty();
        TrackObject track = item.track();

        String name = NormalizeUtils.norm(track.name());
        if (name == null) return Optional.empty();

        long ms = track.durationMs() == null ? 0L : track.durationMs();
        if (ms <= 0) return Optional.empty();

        Instant playedAt = NormalizeUtils.parseInstantOrNull(item.playedAt());
        if (playedAt == null) return Optional.empty();

        return Optional.of(new ListeningEvent(
                name,
                artistName(track.artists(), mode),
                playedAt,
                ms,
                ListeningSource.LIVE_SYNC
        ));
    }

    private static String artistName(List<ArtistObject> artists, ArtistNameMode mode) {
        if (artists == null || artists.isEmpty()) return "";
        List<String> names = artists.stream().map(ArtistObject::name).toList();
        if (mode == ArtistNameMode.FIRST_ARTIST) {
            String first = NormalizeUtils.firstNonBlank(names.toArray(new String[0]));
            return first == null ? "" : first;
        }
        return NormalizeUtils.joinArtists(names);
    }

    private static long firstPositive(Long a, Long b) {
        if (a != null && a > 0) return a;
        if (b != null && b > 0) return b;
        return 0L;
    }
}
