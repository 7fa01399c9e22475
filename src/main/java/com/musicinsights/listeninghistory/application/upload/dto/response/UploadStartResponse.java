package com.musicinsights.listeninghistory.application.upload.dto.response;

/**
 * 업로드/동기화 시작 응답.
 *
 * @param success 접수 여부
 * @param jobId   상태 조회에 사용할 job ID
 * @param message 안내 메시지
 */
public record UploadStartResponse(
        boolean success,
        String jobId,
        String message
) {
    public static UploadStartResponse accepted(String jobId, String message) {
        return new UploadStartResponse(true, jobId, message);
    }
}
