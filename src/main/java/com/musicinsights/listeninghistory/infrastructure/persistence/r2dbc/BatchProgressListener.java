package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc;

/**
 * 배치 쓰기 진행 상황 콜백.
 */
@FunctionalInterface
public interface BatchProgressListener {

    BatchProgressListener NONE = (percent, message) -> { };

    /**
     * @param percentComplete 완료된 chunk 비율(0~100)
     * @param message         진행 설명
     */
    void onProgress(int percentComplete, String message);
}
