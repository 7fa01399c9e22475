package com.musicinsights.listeninghistory.infrastructure.input.archive;

import java.util.List;
import java.util.Locale;

/**
 * 아카이브 항목 이름으로 청취 기록 파일 여부를 판단합니다.
 * <p>
 * 내보내기 서비스의 파일 명명 규칙이 여러 번 바뀌었으므로 알려진 변형을 모두 허용하고,
 * 같은 아카이브에 들어 있는 영상 시청 기록("video")은 항상 제외합니다.
 */
public final class ArchiveEntryMatcher {

    private static final String DATA_EXTENSION = ".json";

    /** 알려진 오디오 기록 파일명 변형(소문자 경로 기준 포함 여부) */
    private static final List<String> HISTORY_PATTERNS = List.of(
            "streaming_history_audio",
            "streaminghistory_music",
            "streaming_history",
            "streaminghistory"
    );

    private static final String EXCLUDED = "video";

    private ArchiveEntryMatcher() {
    }

    /**
     * 알려진 오디오 기록 패턴에 맞는 항목인지 확인합니다.
     *
     * @param path 아카이브 내 경로
     * @return 오디오 기록 파일이면 true
     */
    public static boolean isHistoryFile(String path) {
        String lower = lower(path);
        return isDataFile(lower) && HISTORY_PATTERNS.stream().anyMatch(lower::contains);
    }

    /**
     * 패턴과 무관하게 데이터 파일(.json)인지 확인합니다. 이름이 바뀐 내보내기를 위한 대체 조건입니다.
     *
     * @param path 아카이브 내 경로
     * @return 영상 기록이 아닌 .json 파일이면 true
     */
    public static boolean isFallbackCandidate(String path) {
        return isDataFile(lower(path));
    }

    private static boolean isDataFile(String lower) {
        return lower.endsWith(DATA_EXTENSION) && !lower.contains(EXCLUDED);
    }

    private static String lower(String path) {
        return path == null ? "" : path.toLowerCase(Locale.ROOT);
    }
}
