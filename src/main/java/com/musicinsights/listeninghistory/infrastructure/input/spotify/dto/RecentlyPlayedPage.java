package com.musicinsights.listeninghistory.infrastructure.input.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 최근 재생 목록 응답 한 페이지.
 *
 * @param items   재생 항목(최신순)
 * @param cursors 페이지 커서
 * @param next    다음 페이지 URL(없으면 null)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecentlyPlayedPage(
        List<PlayHistoryItem> items,
        Cursors cursors,
        String next
) {
    /**
     * @param after  이후 구간 커서(epoch ms 문자열)
     * @param before 이전 구간 커서(epoch ms 문자열)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Cursors(String after, String before) {
    }
}
