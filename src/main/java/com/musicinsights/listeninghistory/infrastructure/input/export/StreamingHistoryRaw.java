package com.musicinsights.listeninghistory.infrastructure.input.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 스트리밍 기록 내보내기 파일의 "한 항목(= 한 번의 재생)"을 매핑하기 위한 원본 DTO입니다.
 * <p>
 * 내보내기 형식이 두 가지이므로 두 형식의 필드를 모두 선언하고,
 * 정규화 단계({@link com.musicinsights.listeninghistory.infrastructure.mapper.ListeningEventNormalizer})에서 하나로 합칩니다.
 * <ul>
 *     <li>기존 형식: endTime, artistName, trackName, msPlayed</li>
 *     <li>확장 형식: ts, master_metadata_album_artist_name, master_metadata_track_name, ms_played</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamingHistoryRaw {

    /** 재생 종료 시각(기존 형식, 예: "2023-01-05 14:03") */
    @JsonProperty("endTime")
    public String endTime;

    /** 재생 종료 시각(확장 형식, 예: "2023-01-05T14:03:11Z") */
    @JsonProperty("ts")
    public String ts;

    /** 재생 시각(일부 변형 파일) */
    @JsonProperty("played_at")
    public String playedAt;

    @JsonProperty("artistName")
    public String artistName;

    @JsonProperty("master_metadata_album_artist_name")
    public String masterArtistName;

    @JsonProperty("trackName")
    public String trackName;

    /** 곡 제목(확장 형식). 팟캐스트/오디오북 항목은 비어 있다. */
    @JsonProperty("master_metadata_track_name")
    public String masterTrackName;

    @JsonProperty("msPlayed")
    public Long msPlayed;

    @JsonProperty("ms_played")
    public Long msPlayedExtended;
}
