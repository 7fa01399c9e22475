package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.H2TestDatabase;
import com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row.SummaryRow;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link UserDataSummaryRepo} 통합 테스트(H2, MySQL 호환 모드).
 */
@DisplayName("user data summary repo 테스트")
class UserDataSummaryRepoTest {

    private static H2TestDatabase database;
    private UserDataSummaryRepo repo;

    @BeforeAll
    static void init() {
        database = H2TestDatabase.create("user_data_summary_repo");
    }

    @BeforeEach
    void clean() {
        database.clear();
        repo = new UserDataSummaryRepo(database.client());
    }

    @DisplayName("같은 사용자로 upsert하면 행이 하나로 유지되고 값이 갱신되는지 검증")
    @Test
    void upsert_sameUser_replacesValues() {
        Instant first = Instant.parse("2024-05-01T00:00:00Z");
        Instant second = Instant.parse("2024-05-02T00:00:00Z");

        repo.upsert(new SummaryRow("u1", 2, 1, 3000,
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z"), first)).block();
        repo.upsert(new SummaryRow("u1", 5, 3, 9000,
                Instant.parse("2023-12-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"), second)).block();

        StepVerifier.create(repo.findByUser("u1"))
                .assertNext(r -> {
                    assertThat(r.totalTracks()).isEqualTo(5L);
                    assertThat(r.totalArtists()).isEqualTo(3L);
                    assertThat(r.totalListeningTimeMs()).isEqualTo(9000L);
                    assertThat(r.dateRangeStart()).isEqualTo(Instant.parse("2023-12-01T00:00:00Z"));
                    assertThat(r.uploadedAt()).isEqualTo(second);
                })
                .verifyComplete();
    }

    @DisplayName("이벤트가 없는 요약은 기간을 null로 저장할 수 있는지 검증")
    @Test
    void upsert_emptyRange_allowsNulls() {
        repo.upsert(new SummaryRow("u1", 0, 0, 0, null, null, Instant.parse("2024-05-01T00:00:00Z"))).block();

        StepVerifier.create(repo.findByUser("u1"))
                .assertNext(r -> {
                    assertThat(r.totalTracks()).isZero();
                    assertThat(r.dateRangeStart()).isNull();
                    assertThat(r.dateRangeEnd()).isNull();
                })
                .verifyComplete();
    }

    @DisplayName("요약이 없는 사용자는 empty, 삭제 후에도 empty로 조회되는지 검증")
    @Test
    void findAndDelete() {
        StepVerifier.create(repo.findByUser("u1")).verifyComplete();

        repo.upsert(new SummaryRow("u1", 1, 1, 10, null, null, Instant.parse("2024-05-01T00:00:00Z"))).block();
        StepVerifier.create(repo.deleteByUser("u1")).expectNext(1L).verifyComplete();
        StepVerifier.create(repo.findByUser("u1")).verifyComplete();
    }
}
