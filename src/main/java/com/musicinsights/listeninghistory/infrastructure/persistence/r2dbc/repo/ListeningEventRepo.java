package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import com.musicinsights.listeninghistory.application.listening.model.ListeningSource;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row.ListeningStatsRow;
import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * listening_event 테이블에 대한 적재/조회/삭제 기능을 제공하는 Repository입니다.
 * <p>
 * 이벤트는 추가와 사용자 단위 일괄 삭제만 일어나며 갱신(update)은 하지 않습니다.
 * 한 번의 INSERT에 담기는 행 수는 호출자({@link com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.ListeningBatchWriter})가 제한합니다.
 */
@Component
public class ListeningEventRepo extends BatchSqlSupport {

    private static final String EVENT_COLUMNS =
            "id, track_name, artist_name, played_at, duration_ms, source";

    public ListeningEventRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 이벤트 목록을 단일 multi-row INSERT로 저장합니다.
     *
     * @param userId 사용자 ID
     * @param events 저장할 이벤트(비어 있으면 0 반환)
     * @return 저장된 행 수
     */
    public Mono<Long> insertChunk(String userId, List<ListeningEvent> events) {
        if (events == null || events.isEmpty()) return Mono.just(0L);

        StringBuilder sql = new StringBuilder("""
            INSERT INTO listening_event (
              user_id, track_name, artist_name, played_at, duration_ms, source
            ) VALUES
        """);

        for (int i = 0; i < events.size(); i++) {
            if (i > 0) sql.append(",");
            sql.append("(:u%d, :t%d, :a%d, :p%d, :d%d, :s%d)".formatted(i, i, i, i, i, i));
        }

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql.toString());
        for (int i = 0; i < events.size(); i++) {
            ListeningEvent e = events.get(i);
            spec = spec.bind("u" + i, userId)
                    .bind("t" + i, e.trackName())
                    .bind("a" + i, e.artistName())
                    .bind("p" + i, toDb(e.playedAt()))
                    .bind("d" + i, e.durationMs())
                    .bind("s" + i, e.source().value());
        }

        return spec.fetch().rowsUpdated();
    }

    /**
     * 사용자의 저장 이벤트 수를 조회합니다.
     *
     * @param userId 사용자 ID
     * @return 이벤트 수
     */
    public Mono<Long> countByUser(String userId) {
        return db.sql("SELECT COUNT(*) AS cnt FROM listening_event WHERE user_id = :u")
                .bind("u", userId)
                .map((row, meta) -> asLong(row.get("cnt")))
                .one()
                .defaultIfEmpty(0L);
    }

    /**
     * 사용자 전체 이벤트의 수/서로 다른 아티스트 수/총 재생 시간/최소·최대 재생 시각을 한 번에 조회합니다.
     *
     * @param userId 사용자 ID
     * @return 집계 결과
     */
    public Mono<ListeningStatsRow> summarize(String userId) {
        String sql = """
            SELECT COUNT(*) AS total_tracks,
                   COUNT(DISTINCT artist_name) AS total_artists,
                   COALESCE(SUM(duration_ms), 0) AS total_ms,
                   MIN(played_at) AS first_played,
                   MAX(played_at) AS last_played
            FROM listening_event
            WHERE user_id = :u
        """;

        return db.sql(sql)
                .bind("u", userId)
                .map((row, meta) -> new ListeningStatsRow(
                        asLong(row.get("total_tracks")),
                        asLong(row.get("total_artists")),
                        asLong(row.get("total_ms")),
                        fromDb(row.get("first_played", LocalDateTime.class)),
                        fromDb(row.get("last_played", LocalDateTime.class))
                ))
                .one();
    }

    /**
     * 최근 재생순으로 최대 {@code limit}건을 조회합니다.
     *
     * @param userId 사용자 ID
     * @param limit  최대 건수
     * @return 최근 이벤트(최신순)
     */
    public Flux<ListeningEvent> findRecent(String userId, int limit) {
        String sql = """
            SELECT %s
            FROM listening_event
            WHERE user_id = :u
            ORDER BY played_at DESC, id DESC
            LIMIT :n
        """.formatted(EVENT_COLUMNS);

        return db.sql(sql)
                .bind("u", userId)
                .bind("n", limit)
                .map((row, meta) -> toEvent(row))
                .all();
    }

    /**
     * 사용자의 전체 이벤트를 저장 순서(id)대로 페이지 단위로 읽어 옵니다.
     * <p>
     * 마지막으로 읽은 id 이후를 조회하는 keyset 방식이므로 OFFSET 비용이 누적되지 않습니다.
     *
     * @param userId   사용자 ID
     * @param pageSize 한 번에 조회할 행 수
     * @return 전체 이벤트(저장 순서)
     */
    public Flux<ListeningEvent> findAllByUser(String userId, int pageSize) {
        return fetchPage(userId, 0L, pageSize)
                .expand(page -> page.size() < pageSize
                        ? Mono.empty()
                        : fetchPage(userId, page.get(page.size() - 1).id(), pageSize))
                .flatMapIterable(page -> page)
                .map(StoredEvent::event);
    }

    /**
     * 사용자의 이벤트를 모두 삭제합니다.
     *
     * @param userId 사용자 ID
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteByUser(String userId) {
        return db.sql("DELETE FROM listening_event WHERE user_id = :u")
                .bind("u", userId)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 기준 시각 이하의 이벤트를 삭제합니다.
     * <p>
     * 전체 기록을 다시 업로드할 때, 업로드 범위 밖의 더 최신 동기화 데이터를 보존하기 위해 사용합니다.
     *
     * @param userId 사용자 ID
     * @param cutoff 기준 시각(포함)
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteByUserUpTo(String userId, Instant cutoff) {
        return db.sql("DELETE FROM listening_event WHERE user_id = :u AND played_at <= :c")
                .bind("u", userId)
                .bind("c", toDb(cutoff))
                .fetch()
                .rowsUpdated();
    }

    private Mono<List<StoredEvent>> fetchPage(String userId, long afterId, int pageSize) {
        String sql = """
            SELECT %s
            FROM listening_event
            WHERE user_id = :u AND id > :after
            ORDER BY id
            LIMIT :n
        """.formatted(EVENT_COLUMNS);

        return db.sql(sql)
                .bind("u", userId)
                .bind("after", afterId)
                .bind("n", pageSize)
                .map((row, meta) -> new StoredEvent(row.get("id", Long.class), toEvent(row)))
                .all()
                .collectList();
    }

    private static ListeningEvent toEvent(Row row) {
        Long duration = row.get("duration_ms", Long.class);
        return new ListeningEvent(
                row.get("track_name", String.class),
                row.get("artist_name", String.class),
                fromDb(row.get("played_at", LocalDateTime.class)),
                duration == null ? 0L : duration,
                ListeningSource.fromValue(row.get("source", String.class))
        );
    }

    /** keyset 페이지 조회용(id + 이벤트) */
    private record StoredEvent(long id, ListeningEvent event) {}
}
