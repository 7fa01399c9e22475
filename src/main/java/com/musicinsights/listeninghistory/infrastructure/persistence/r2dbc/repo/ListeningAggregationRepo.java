package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row.AggregationRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

/**
 * listening_aggregation 테이블에 대한 Repository입니다.
 * <p>
 * (사용자, 집계 종류, 날짜 단위)마다 1행을 가지며, 재계산 시 부분 수정 없이 통째로 교체합니다.
 */
@Component
public class ListeningAggregationRepo extends BatchSqlSupport {

    /** 집계 행 INSERT 시 한 번에 처리할 최대 행 수 */
    private static final int CHUNK = 100;

    public ListeningAggregationRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 사용자의 집계 행을 모두 삭제합니다.
     *
     * @param userId 사용자 ID
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteByUser(String userId) {
        return db.sql("DELETE FROM listening_aggregation WHERE user_id = :u")
                .bind("u", userId)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 집계 행을 저장합니다.
     *
     * @param userId 사용자 ID
     * @param rows   저장할 집계 행
     * @return 저장된 행 수
     */
    public Mono<Long> insertAll(String userId, List<AggregationRow> rows) {
        return chunkedSum(rows, CHUNK, chunk -> insertOnce(userId, chunk));
    }

    /**
     * 집계 행 하나를 조회합니다.
     *
     * @param userId  사용자 ID
     * @param kind    집계 종류
     * @param groupBy 날짜 단위(날짜 빈도 외 종류는 null)
     * @return 집계 행(계산된 적이 없으면 empty)
     */
    public Mono<AggregationRow> find(String userId, String kind, String groupBy) {
        String groupFilter = groupBy == null ? "group_by IS NULL" : "group_by = :g";
        String sql = """
            SELECT kind, group_by, payload, computed_at
            FROM listening_aggregation
            WHERE user_id = :u AND kind = :k AND %s
            ORDER BY id DESC
            LIMIT 1
        """.formatted(groupFilter);

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql)
                .bind("u", userId)
                .bind("k", kind);
        if (groupBy != null) {
            spec = spec.bind("g", groupBy);
        }

        return spec.map((row, meta) -> new AggregationRow(
                        row.get("kind", String.class),
                        row.get("group_by", String.class),
                        row.get("payload", String.class),
                        fromDb(row.get("computed_at", LocalDateTime.class))
                ))
                .one();
    }

    private Mono<Long> insertOnce(String userId, List<AggregationRow> rows) {
        if (rows.isEmpty()) return Mono.just(0L);

        StringBuilder sql = new StringBuilder("""
            INSERT INTO listening_aggregation (
              user_id, kind, group_by, payload, computed_at
            ) VALUES
        """);

        for (int i = 0; i < rows.size(); i++) {
            if (i > 0) sql.append(",");
            sql.append("(:u%d, :k%d, :g%d, :p%d, :c%d)".formatted(i, i, i, i, i));
        }

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql.toString());
        for (int i = 0; i < rows.size(); i++) {
            AggregationRow r = rows.get(i);
            spec = spec.bind("u" + i, userId)
                    .bind("k" + i, r.kind());
            spec = bindOrNull(spec, "g" + i, r.groupBy(), String.class);
            spec = spec.bind("p" + i, r.payload())
                    .bind("c" + i, toDb(r.computedAt()));
        }

        return spec.fetch().rowsUpdated();
    }
}
