package com.musicinsights.listeninghistory.application.job;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 업로드/동기화 job 상태.
 *
 * <p>전이 순서: pending → extracting → processing → storing → completed.
 * 단계를 건너뛰거나 되돌아갈 수 없고, failed는 종료되지 않은 모든 상태에서 진입할 수 있다.
 * 같은 상태 안에서의 진행률/메시지 갱신은 허용한다.</p>
 */
public enum JobStatus {
    PENDING("pending"),
    EXTRACTING("extracting"),
    PROCESSING("processing"),
    STORING("storing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 현재 상태에서 {@code next}로 이동할 수 있는지 확인한다.
     *
     * @param next 다음 상태
     * @return 허용되는 전이이면 true
     */
    public boolean allows(JobStatus next) {
        if (isTerminal()) return false;
        if (next == FAILED || next == this) return true;
        return next.ordinal() == ordinal() + 1;
    }
}
