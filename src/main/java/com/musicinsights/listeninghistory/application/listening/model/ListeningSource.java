package com.musicinsights.listeninghistory.application.listening.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 청취 이벤트의 출처.
 */
public enum ListeningSource {
    /** 사용자가 내려받은 전체 기록 아카이브 */
    BULK_EXPORT("bulk-export"),
    /** 외부 API의 최근 재생 목록 동기화 */
    LIVE_SYNC("live-sync");

    private final String value;

    ListeningSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * 저장된 문자열 값으로 enum을 찾는다.
     *
     * @param value DB/응답에 쓰이는 값(bulk-export, live-sync)
     * @return 대응하는 출처
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static ListeningSource fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown listening source: " + value));
    }
}
