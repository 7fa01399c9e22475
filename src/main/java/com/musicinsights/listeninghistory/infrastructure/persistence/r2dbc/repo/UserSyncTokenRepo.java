package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row.SyncTokenRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * 주기 동기화 대상 사용자와 자격 증명을 보관하는 user_sync_token 테이블 Repository입니다.
 * <p>
 * 토큰 값은 불투명 문자열로만 다루며 검증/갱신은 인증 담당 구성요소의 몫입니다.
 */
@Component
public class UserSyncTokenRepo extends BatchSqlSupport {

    public UserSyncTokenRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 사용자 토큰을 저장(있으면 교체)합니다.
     *
     * @param userId      사용자 ID
     * @param accessToken 접근 토큰
     * @param now         저장 시각
     * @return 영향을 받은 행 수
     */
    public Mono<Long> save(String userId, String accessToken, Instant now) {
        String sql = """
            INSERT INTO user_sync_token (user_id, access_token, updated_at)
            VALUES (:u, :t, :now)
            ON DUPLICATE KEY UPDATE
              access_token = VALUES(access_token),
              updated_at = VALUES(updated_at)
        """;

        return db.sql(sql)
                .bind("u", userId)
                .bind("t", accessToken)
                .bind("now", toDb(now))
                .fetch()
                .rowsUpdated();
    }

    /**
     * 저장된 모든 사용자 토큰을 사용자 ID 순으로 조회합니다.
     *
     * @return 사용자 토큰 목록
     */
    public Flux<SyncTokenRow> findAll() {
        return db.sql("SELECT user_id, access_token FROM user_sync_token ORDER BY user_id")
                .map((row, meta) -> new SyncTokenRow(
                        row.get("user_id", String.class),
                        row.get("access_token", String.class)
                ))
                .all();
    }
}
