package com.musicinsights.listeninghistory.application.common.error;

/**
 * 집계 결과 저장(삭제 후 삽입) 실패 예외.
 *
 * <p>로그로만 남기며 업로드/동기화 job을 실패시키지 않는다.</p>
 */
public class AggregationStorageException extends ListeningPipelineException {

    public AggregationStorageException(String userId, Throwable cause) {
        super("Failed to store aggregations for user " + userId + ": " + cause.getMessage(),
                "AGGREGATION_STORAGE_ERROR", cause);
    }
}
