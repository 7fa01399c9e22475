package com.musicinsights.listeninghistory.application.common.error;

/**
 * 업로드/동기화 파이프라인에서 발생하는 예외의 공통 상위 타입.
 *
 * <p>job 상태 조회 응답의 error 필드와 로그에서 원인을 구분할 수 있도록
 * 고정된 code 값을 함께 보관한다.</p>
 */
public abstract class ListeningPipelineException extends RuntimeException {
    private final String code;

    protected ListeningPipelineException(String message, String code) {
        super(message);
        this.code = code;
    }

    protected ListeningPipelineException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
