package com.musicinsights.listeninghistory.infrastructure.mapper;

import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import com.musicinsights.listeninghistory.application.listening.model.ListeningSource;
import com.musicinsights.listeninghistory.infrastructure.input.export.StreamingHistoryRaw;
import com.musicinsights.listeninghistory.infrastructure.input.spotify.dto.ArtistObject;
import com.musicinsights.listeninghistory.infrastructure.input.spotify.dto.PlayHistoryItem;
import com.musicinsights.listeninghistory.infrastructure.input.spotify.dto.TrackObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link ListeningEventNormalizer} 단위 테스트.
 *
 * <p>두 가지 내보내기 형식과 최근 재생 API 항목이 같은 이벤트 형태로 정규화되는지,
 * 제외 규칙(트랙명 없음, 재생 시간 0 이하, 시각 해석 불가)이 지켜지는지 검증한다.</p>
 */
@DisplayName("listening event normalizer 테스트")
class ListeningEventNormalizerTest {

    private final ListeningEventNormalizer normalizer = new ListeningEventNormalizer();

    @DisplayName("계정 데이터 형식 행이 bulk-export 이벤트로 정규화되는지 검증")
    @Test
    void fromExport_accountFormat() {
        StreamingHistoryRaw raw = new StreamingHistoryRaw();
        raw.endTime = "2024-01-01 10:00";
        raw.artistName = " Artist A ";
        raw.trackName = "Song 1";
        raw.msPlayed = 1000L;

        ListeningEvent e = normalizer.fromExport(raw).orElseThrow();

        assertThat(e.trackName()).isEqualTo("Song 1");
        assertThat(e.artistName()).isEqualTo("Artist A");
        assertThat(e.playedAt()).isEqualTo(Instant.parse("2024-01-01T10:00:00Z"));
        assertThat(e.durationMs()).isEqualTo(1000L);
        assertThat(e.source()).isEqualTo(ListeningSource.BULK_EXPORT);
    }

    @DisplayName("확장 형식 행을 읽고, 아티스트가 없으면 빈 문자열로 채우는지 검증")
    @Test
    void fromExport_extendedFormat_missingArtist() {
        StreamingHistoryRaw raw = new StreamingHistoryRaw();
        raw.ts = "2024-01-03T08:00:00Z";
        raw.masterTrackName = "Podcast-ish";
        raw.msPlayedExtended = 4000L;

        ListeningEvent e = normalizer.fromExport(raw).orElseThrow();

        assertThat(e.artistName()).isEmpty();
        assertThat(e.playedAt()).isEqualTo(Instant.parse("2024-01-03T08:00:00Z"));
    }

    @DisplayName("트랙명 없음/재생 시간 0/시각 해석 불가 행은 제외되는지 검증")
    @Test
    void fromExport_dropsInvalidRows() {
        StreamingHistoryRaw noTrack = raw(null, "2024-01-01 10:00", 1000L);
        StreamingHistoryRaw zeroMs = raw("Song", "2024-01-01 10:00", 0L);
        StreamingHistoryRaw badTime = raw("Song", "not a time", 1000L);
        StreamingHistoryRaw ok = raw("Song", "2024-01-01 10:00", 1L);

        assertThat(normalizer.fromExport(noTrack)).isEmpty();
        assertThat(normalizer.fromExport(zeroMs)).isEmpty();
        assertThat(normalizer.fromExport(badTime)).isEmpty();
        assertThat(normalizer.fromExport(List.of(noTrack, zeroMs, badTime, ok))).hasSize(1);
    }

    @DisplayName("최근 재생 항목은 live-sync 이벤트가 되고 아티스트 이름 규칙을 따르는지 검증")
    @Test
    void fromRecentlyPlayed_artistModes() {
        PlayHistoryItem item = new PlayHistoryItem(
                new TrackObject("t1", "Duet", 180_000L,
                        List.of(new ArtistObject("a1", "First"), new ArtistObject("a2", "Second"))),
                "2024-02-01T12:34:56.789Z");

        ListeningEvent joined = normalizer.fromRecentlyPlayed(item, ArtistNameMode.JOINED).orElseThrow();
        ListeningEvent first = normalizer.fromRecentlyPlayed(item, ArtistNameMode.FIRST_ARTIST).orElseThrow();

        assertThat(joined.artistName()).isEqualTo("First, Second");
        assertThat(first.artistName()).isEqualTo("First");
        assertThat(joined.source()).isEqualTo(ListeningSource.LIVE_SYNC);
        assertThat(joined.playedAt()).isEqualTo(Instant.parse("2024-02-01T12:34:56.789Z"));
        assertThat(joined.durationMs()).isEqualTo(180_000L);
    }

    @DisplayName("트랙 정보나 재생 시간이 없는 최근 재생 항목은 제외되는지 검증")
    @Test
    void fromRecentlyPlayed_dropsIncomplete() {
        Optional<ListeningEvent> noTrack = normalizer.fromRecentlyPlayed(
                new PlayHistoryItem(null, "2024-02-01T12:00:00Z"), ArtistNameMode.JOINED);
        Optional<ListeningEvent> noDuration = normalizer.fromRecentlyPlayed(
                new PlayHistoryItem(new TrackObject("t", "Song", null, List.of()), "2024-02-01T12:00:00Z"),
                ArtistNameMode.JOINED);

        assertThat(noTrack).isEmpty();
        assertThat(noDuration).isEmpty();
    }

    private static StreamingHistoryRaw raw(String track, String endTime, Long ms) {
        StreamingHistoryRaw r = new StreamingHistoryRaw();
        r.trackName = track;
        r.endTime = endTime;
        r.msPlayed = ms;
        r.artistName = "A";
        return r;
    }
}
