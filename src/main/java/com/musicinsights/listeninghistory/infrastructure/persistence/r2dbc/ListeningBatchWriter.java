package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc;

import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.application.common.error.ListeningStorageException;
import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo.ListeningEventRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 청취 이벤트를 저장소의 요청당 행 수 상한에 맞춰 나누어 저장하는 배치 writer입니다.
 * <p>
 * 흐름: chunk 분할(상한 크기) → chunk 묶음(동시 실행 수) 단위로 병렬 INSERT → 묶음마다 진행률 통지
 * <p>
 * 한 chunk라도 실패하면 실패한 chunk 인덱스를 담은 {@link ListeningStorageException}으로 중단합니다.
 * 이미 저장된 chunk는 롤백하지 않으며, 재시도 시 중복은 다음 동기화의 자연키 중복 제거로 완화합니다.
 */
@Component
public class ListeningBatchWriter {

    private static final Logger log = LoggerFactory.getLogger(ListeningBatchWriter.class);

    private final ListeningEventRepo repo;
    private final int chunkSize;
    private final int concurrency;

    public ListeningBatchWriter(ListeningEventRepo repo, ListeningPipelineProperties props) {
        this.repo = repo;
        this.chunkSize = Math.max(1, props.getBatch().getChunkSize());
        this.concurrency = Math.max(1, props.getBatch().getConcurrency());
    }

    /**
     * 이벤트를 chunk 단위로 저장합니다.
     *
     * @param userId   사용자 ID
     * @param events   저장할 이벤트(순서 유지)
     * @param listener 진행률 콜백
     * @return 저장된 행 수 합계
     */
    public Mono<Long> write(String userId, List<ListeningEvent> events, BatchProgressListener listener) {
        if (events == null || events.isEmpty()) return Mono.just(0L);

        return Flux.fromIterable(events)
                .buffer(chunkSize)
                .collectList()
                .flatMap(chunks -> writeChunks(userId, chunks, listener));
    }

    private Mono<Long> writeChunks(String userId, List<List<ListeningEvent>> chunks, BatchProgressListener listener) {
        int total = chunks.size();
        AtomicInteger completed = new AtomicInteger();
        log.info("Writing {} events for user {} in {} chunks (concurrency {})",
                chunks.stream().mapToInt(List::size).sum(), userId, total, concurrency);

        return Flux.range(0, total)
                .buffer(concurrency)
                .concatMap(group -> Flux.fromIterable(group)
                        .flatMap(idx -> writeChunk(userId, idx, total, chunks.get(idx)), concurrency)
                        .reduce(0L, Long::sum)
                        .doOnNext(rows -> {
                            int done = completed.addAndGet(group.size());
                            int percent = done * 100 / total;
                            listener.onProgress(percent, "Stored " + done + "/" + total + " chunks");
                        }))
                .reduce(0L, Long::sum);
    }

    private Mono<Long> writeChunk(String userId, int index, int total, List<ListeningEvent> chunk) {
        return Mono.defer(() -> repo.insertChunk(userId, chunk))
                .onErrorMap(e -> !(e instanceof ListeningStorageException),
                        e -> new ListeningStorageException(index, total, e));
    }
}
