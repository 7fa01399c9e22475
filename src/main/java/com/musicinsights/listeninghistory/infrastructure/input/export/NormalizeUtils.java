package com.musicinsights.listeninghistory.infrastructure.input.export;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 적재 과정에서 반복적으로 사용하는 "정규화/파싱" 유틸리티입니다.
 * <p>
 * - 문자열 정규화(trim, 빈 값 처리)
 * - 재생 시각 파싱
 * - 아티스트 목록 연결
 */
public final class NormalizeUtils {

    /** 기존 내보내기 형식의 시각("2023-01-05 14:03", 초는 선택) */
    private static final DateTimeFormatter LEGACY_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    /** 여러 아티스트를 하나의 문자열로 합칠 때의 구분자 */
    public static final String ARTIST_SEPARATOR = ", ";

    private NormalizeUtils() {
    }

    /**
     * 문자열을 정규화합니다.
     * <p>
     * trim 후 빈 문자열이면 null을 반환합니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * 첫 번째로 비어 있지 않은 값을 반환합니다.
     *
     * @param values 후보 값
     * @return 정규화된 첫 값 또는 null
     */
    public static String firstNonBlank(String... values) {
        for (String v : values) {
            String n = norm(v);
            if (n != null) return n;
        }
        return null;
    }

    /**
     * 재생 시각 문자열을 {@link Instant}로 파싱합니다.
     * <p>
     * 허용 형식: ISO-8601 instant("...Z"), 오프셋 포함 시각, 오프셋 없는 ISO 시각,
     * "yyyy-MM-dd HH:mm[:ss]". 오프셋이 없으면 UTC로 해석합니다.
     * 빈 값이거나 파싱에 실패하면 null을 반환합니다.
     *
     * @param s 시각 문자열
     * @return 파싱된 Instant 또는 null
     */
    public static Instant parseInstantOrNull(String s) {
        String v = norm(s);
        if (v == null) return null;
        DateTimeFormatter fmt = v.indexOf('T') > 0 ? DateTimeFormatter.ISO_DATE_TIME : LEGACY_TIMESTAMP;
        try {
            TemporalAccessor parsed = fmt.parseBest(v, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * 아티스트명 목록을 ", "로 연결합니다. 빈 이름은 제외합니다.
     *
     * @param names 아티스트명 목록
     * @return 연결된 문자열(모두 비어 있으면 빈 문자열)
     */
    public static String joinArtists(List<String> names) {
        if (names == null) return "";
        return names.stream()
                .map(NormalizeUtils::norm)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(ARTIST_SEPARATOR));
    }
}
