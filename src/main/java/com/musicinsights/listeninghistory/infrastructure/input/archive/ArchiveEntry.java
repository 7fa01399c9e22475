package com.musicinsights.listeninghistory.infrastructure.input.archive;

/**
 * 아카이브에서 읽어 낸 파일 하나.
 *
 * @param name    아카이브 내 전체 경로
 * @param content 파일 내용
 */
public record ArchiveEntry(String name, byte[] content) {
}
