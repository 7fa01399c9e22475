package com.musicinsights.listeninghistory.bootstrap;

import com.musicinsights.listeninghistory.application.job.JobResult;
import com.musicinsights.listeninghistory.application.upload.service.ListeningIngestService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 로컬 내보내기 파일을 HTTP 업로드 없이 바로 적재하는 {@link CommandLineRunner}.
 *
 * <p>Profile이 {@code ingest}일 때만 활성화된다. 인자는 {@code <userId> <파일 경로>} 순서이다.</p>
 * <p>흐름: 파일 읽기 → 업로드와 같은 적재 파이프라인 실행 → 완료까지 {@code block()}</p>
 */
@Component
@Profile("ingest")
public class ArchiveIngestRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ArchiveIngestRunner.class);

    private final ListeningIngestService ingestService;

    public ArchiveIngestRunner(ListeningIngestService ingestService) {
        this.ingestService = ingestService;
    }

    /**
     * 지정된 파일을 적재한다.
     *
     * @param args {@code <userId> <파일 경로>}
     * @throws IllegalArgumentException 인자가 부족한 경우
     */
    @Override
    public void run(String... args) {
        if (args.length < 2) {
            throw new IllegalArgumentException("Usage: --spring.profiles.active=ingest <userId> <export.zip|export.json>");
        }
        String userId = args[0];
        Path path = Path.of(args[1]);

        JobResult result = Mono.fromCallable(() -> Files.readAllBytes(path))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(bytes -> ingestService.ingest(userId, path.getFileName().toString(), bytes,
                        (status, progress, message) -> log.info("[{}%] {} {}", progress, status.value(), message)))
                .doOnError(e -> log.error("Ingest failed for {}: {}", path, e.getMessage()))
                .block();

        if (result != null) {
            log.info("Ingest done. user={}, uploaded={}, total={}, range={}..{}",
                    userId, result.uploadedTracks(), result.totalTracks(),
                    result.dateRangeStart(), result.dateRangeEnd());
        }
    }
}
