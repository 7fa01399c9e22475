package com.musicinsights.listeninghistory.application.common.error;

/**
 * 저장 직후 확인 조회에서 행이 0건으로 조회된 경우의 예외.
 *
 * <p>쓰기가 거부된 {@link ListeningStorageException}과 달리 "쓰기는 성공했으나 데이터가 보이지 않는" 상황을 뜻한다.</p>
 */
public class VerificationException extends ListeningPipelineException {

    public VerificationException(String userId, long expectedRows) {
        super("Expected " + expectedRows + " stored rows for user " + userId + " but found none",
                "VERIFICATION_ERROR");
    }
}
