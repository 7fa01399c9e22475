package com.musicinsights.listeninghistory.application.common.error;

/**
 * 아카이브 안의 개별 파일 하나를 파싱하지 못한 경우의 예외.
 *
 * <p>치명적이지 않다. 로그만 남기고 해당 파일의 기여분을 0건으로 처리한 뒤 추출을 계속한다.</p>
 */
public class ExportParseException extends ListeningPipelineException {
    private final String entryName;

    public ExportParseException(String entryName, Throwable cause) {
        super("Failed to parse " + entryName + ": " + cause.getMessage(), "PARSE_ERROR", cause);
        this.entryName = entryName;
    }

    public String entryName() {
        return entryName;
    }
}
