package com.musicinsights.listeninghistory.application.common.error;

/**
 * 대상 리소스를 찾을 수 없음(404)을 표현하는 예외.
 *
 * <p>보존 기간이 지났거나 형식을 해석할 수 없는 업로드 job id 조회에 사용한다.</p>
 */
public class NotFoundException extends RuntimeException {
    private final String code;

    public NotFoundException(String message, String code) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
