package com.musicinsights.listeninghistory.infrastructure.input.archive;

import com.musicinsights.listeninghistory.application.common.error.ExportParseException;
import com.musicinsights.listeninghistory.application.common.error.ExtractionException;
import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import com.musicinsights.listeninghistory.infrastructure.input.export.ExportDocumentParser;
import com.musicinsights.listeninghistory.infrastructure.mapper.ListeningEventNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * 내보내기 아카이브(zip)에서 청취 기록 파일을 찾아 정규화된 이벤트로 변환합니다.
 * <p>
 * 흐름: 항목 열거 → 이름 패턴 필터(없으면 모든 .json으로 대체) → 항목별 병렬 파싱/정규화 → 단순 연결
 * <p>
 * 개별 파일의 파싱 실패는 로그만 남기고 계속 진행하며,
 * 모든 후보를 처리한 뒤 결과가 0건일 때만 {@link ExtractionException}으로 실패합니다.
 */
@Component
public class ArchiveExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);

    private final ExportDocumentParser parser;
    private final ListeningEventNormalizer normalizer;

    public ArchiveExtractor(ExportDocumentParser parser, ListeningEventNormalizer normalizer) {
        this.parser = parser;
        this.normalizer = normalizer;
    }

    /**
     * zip 아카이브에서 청취 이벤트를 추출합니다.
     * <p>
     * 파일 간 순서 의존성이 없으므로 항목별 파싱은 {@link Schedulers#boundedElastic()}에서 병렬로 실행하고,
     * 결과 순서는 보장하지 않습니다.
     *
     * @param archive zip 바이트
     * @return 정규화된 이벤트 목록
     */
    public Mono<List<ListeningEvent>> extract(byte[] archive) {
        return Mono.fromCallable(() -> candidates(readEntries(archive)))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable)
                .flatMap(entry -> Mono.fromCallable(() -> parseEntry(entry))
                        .subscribeOn(Schedulers.boundedElastic()))
                .collectList()
                .map(ArchiveExtractor::concatOrFail);
    }

    /**
     * 아카이브가 아닌 단일 JSON 문서에서 청취 이벤트를 추출합니다.
     *
     * @param name     파일 이름
     * @param document JSON 바이트
     * @return 정규화된 이벤트 목록
     */
    public Mono<List<ListeningEvent>> extractDocument(String name, byte[] document) {
        return Mono.fromCallable(() -> {
                    try {
                        return normalizer.fromExport(parser.parse(name, document));
                    } catch (ExportParseException e) {
                        throw new ExtractionException("Invalid listening history file: " + name, e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(events -> concatOrFail(List.of(events)));
    }

    private List<ArchiveEntry> readEntries(byte[] archive) {
        List<ArchiveEntry> entries = new ArrayList<>();
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (!entry.isDirectory() && ArchiveEntryMatcher.isFallbackCandidate(entry.getName())) {
                    entries.add(new ArchiveEntry(entry.getName(), zis.readAllBytes()));
                }
                zis.closeEntry();
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new ExtractionException("Unreadable archive: " + e.getMessage(), e);
        }
        return entries;
    }

    private List<ArchiveEntry> candidates(List<ArchiveEntry> dataFiles) {
        List<ArchiveEntry> matched = dataFiles.stream()
                .filter(e -> ArchiveEntryMatcher.isHistoryFile(e.name()))
                .toList();
        if (!matched.isEmpty()) {
            log.info("Found {} listening history files in archive", matched.size());
            return matched;
        }
        log.warn("No files matched known history patterns, falling back to {} data files", dataFiles.size());
        return dataFiles;
    }

    private List<ListeningEvent> parseEntry(ArchiveEntry entry) {
        try {
            List<ListeningEvent> events = normalizer.fromExport(parser.parse(entry.name(), entry.content()));
            log.debug("Processed {}: {} events", entry.name(), events.size());
            return events;
        } catch (ExportParseException e) {
            log.warn("Skipping {}: {}", e.entryName(), e.getMessage());
            return List.of();
        }
    }

    private static List<ListeningEvent> concatOrFail(List<List<ListeningEvent>> perFile) {
        List<ListeningEvent> all = new ArrayList<>();
        perFile.forEach(all::addAll);
        if (all.isEmpty()) {
            throw new ExtractionException("No valid listening history data found in upload");
        }
        log.info("Extracted {} listening events", all.size());
        return all;
    }
}
