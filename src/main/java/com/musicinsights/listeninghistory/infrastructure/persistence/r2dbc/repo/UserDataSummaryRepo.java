package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row.SummaryRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * user_data_summary 테이블(사용자당 1행)에 대한 upsert/조회 Repository입니다.
 */
@Component
public class UserDataSummaryRepo extends BatchSqlSupport {

    public UserDataSummaryRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 요약을 사용자 키 기준으로 교체 저장합니다.
     *
     * @param r 저장할 요약
     * @return 영향을 받은 행 수
     */
    public Mono<Long> upsert(SummaryRow r) {
        String sql = """
            INSERT INTO user_data_summary (
              user_id, total_tracks, total_artists, total_listening_time_ms,
              date_range_start, date_range_end, uploaded_at
            ) VALUES (:u, :tt, :ta, :tm, :ds, :de, :up)
            ON DUPLICATE KEY UPDATE
              total_tracks = VALUES(total_tracks),
              total_artists = VALUES(total_artists),
              total_listening_time_ms = VALUES(total_listening_time_ms),
              date_range_start = VALUES(date_range_start),
              date_range_end = VALUES(date_range_end),
              uploaded_at = VALUES(uploaded_at)
        """;

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql)
                .bind("u", r.userId())
                .bind("tt", r.totalTracks())
                .bind("ta", r.totalArtists())
                .bind("tm", r.totalListeningTimeMs());
        spec = bindOrNull(spec, "ds", toDb(r.dateRangeStart()), LocalDateTime.class);
        spec = bindOrNull(spec, "de", toDb(r.dateRangeEnd()), LocalDateTime.class);
        spec = spec.bind("up", toDb(r.uploadedAt()));

        return spec.fetch().rowsUpdated();
    }

    public Mono<SummaryRow> findByUser(String userId) {
        String sql = """
            SELECT user_id, total_tracks, total_artists, total_listening_time_ms,
                   date_range_start, date_range_end, uploaded_at
            FROM user_data_summary
            WHERE user_id = :u
        """;

        return db.sql(sql)
                .bind("u", userId)
                .map((row, meta) -> new SummaryRow(
                        row.get("user_id", String.class),
                        asLong(row.get("total_tracks")),
                        asLong(row.get("total_artists")),
                        asLong(row.get("total_listening_time_ms")),
                        fromDb(row.get("date_range_start", LocalDateTime.class)),
                        fromDb(row.get("date_range_end", LocalDateTime.class)),
                        fromDb(row.get("uploaded_at", LocalDateTime.class))
                ))
                .one();
    }

    public Mono<Long> deleteByUser(String userId) {
        return db.sql("DELETE FROM user_data_summary WHERE user_id = :u")
                .bind("u", userId)
                .fetch()
                .rowsUpdated();
    }
}
