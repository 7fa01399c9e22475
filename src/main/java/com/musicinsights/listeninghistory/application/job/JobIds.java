package com.musicinsights.listeninghistory.application.job;

import java.time.Instant;
import java.util.Optional;

/**
 * job ID 생성/해석 유틸.
 *
 * <p>형식은 {@code <userId>-<epochMillis>}이다. 사용자 ID에 '-'가 포함될 수 있으므로
 * 마지막 '-' 뒤를 생성 시각으로 본다. 추적 정보가 사라진 job의 경과 시간 추정에 사용한다.</p>
 */
public final class JobIds {

    private JobIds() {
    }

    public static String newId(String userId, Instant createdAt) {
        return userId + "-" + createdAt.toEpochMilli();
    }

    public static Optional<Instant> createdAt(String jobId) {
        int idx = separator(jobId);
        if (idx < 0) return Optional.empty();
        String millis = jobId.substring(idx + 1);
        if (millis.isEmpty() || !millis.chars().allMatch(Character::isDigit)) return Optional.empty();
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(millis)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<String> userId(String jobId) {
        int idx = separator(jobId);
        if (idx <= 0 || createdAt(jobId).isEmpty()) return Optional.empty();
        return Optional.of(jobId.substring(0, idx));
    }

    private static int separator(String jobId) {
        return jobId == null ? -1 : jobId.lastIndexOf('-');
    }
}
