package com.musicinsights.listeninghistory.application.common.error;

/**
 * 아카이브(또는 단일 JSON 파일)에서 사용 가능한 청취 기록을 하나도 얻지 못한 경우의 예외.
 *
 * <p>추출 단계의 유일한 치명적 실패이며, job은 failed로 전환된다.</p>
 */
public class ExtractionException extends ListeningPipelineException {

    public ExtractionException(String message) {
        super(message, "EXTRACTION_ERROR");
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, "EXTRACTION_ERROR", cause);
    }
}
