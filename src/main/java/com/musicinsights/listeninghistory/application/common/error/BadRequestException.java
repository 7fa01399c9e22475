package com.musicinsights.listeninghistory.application.common.error;

/**
 * 잘못된 요청(400)을 표현하는 예외.
 *
 * <p>업로드 파일 형식/크기, 사용자 식별 헤더 누락, 알 수 없는 집계 종류 등
 * 요청 자체가 처리 불가능한 경우에 사용하며, 응답용 code 값을 함께 보관한다.</p>
 */
public class BadRequestException extends RuntimeException {
    private final String code;

    public BadRequestException(String message, String code) {
        super(message);
        this.code = code;
    }

    /**
     * 에러 코드를 반환한다.
     *
     * @return 에러 코드
     */
    public String code() {
        return code;
    }
}
