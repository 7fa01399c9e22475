package com.musicinsights.listeninghistory.application.common.error;

/**
 * 청취 기록 chunk 저장 실패 예외.
 *
 * <p>실패한 chunk의 인덱스(0부터)를 보관한다. 이전 chunk들은 롤백되지 않고 저장된 채로 남는다.</p>
 */
public class ListeningStorageException extends ListeningPipelineException {
    private final int chunkIndex;

    public ListeningStorageException(int chunkIndex, int totalChunks, Throwable cause) {
        super("Failed to store chunk " + (chunkIndex + 1) + "/" + totalChunks + ": " + cause.getMessage(),
                "STORAGE_ERROR", cause);
        this.chunkIndex = chunkIndex;
    }

    public ListeningStorageException(String message, Throwable cause) {
        super(message, "STORAGE_ERROR", cause);
        this.chunkIndex = -1;
    }

    /**
     * 실패한 chunk 인덱스를 반환한다. chunk 단위 실패가 아니면 -1.
     *
     * @return chunk 인덱스
     */
    public int chunkIndex() {
        return chunkIndex;
    }
}
