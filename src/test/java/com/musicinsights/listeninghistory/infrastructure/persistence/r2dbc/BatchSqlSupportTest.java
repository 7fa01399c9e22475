package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link BatchSqlSupport} 유틸 메서드에 대한 단위 테스트.
 *
 * <p>DB 없이 chunk 분할/합산, null-safe 바인딩, UTC 시각 변환, 집계 값 읽기를 검증한다.</p>
 */
@DisplayName("batch sql support 테스트")
class BatchSqlSupportTest {

    /** DB를 사용하지 않으므로 {@link DatabaseClient}는 mock으로 주입한다. */
    static class TestSupport extends BatchSqlSupport {
        TestSupport(DatabaseClient db) { super(db); }
    }

    private final TestSupport support = new TestSupport(Mockito.mock(DatabaseClient.class));

    @DisplayName("chunkedSum에 빈 목록을 주면 함수를 호출하지 않고 0을 반환하는지 검증")
    @Test
    void chunkedSum_empty_returns0() {
        List<List<String>> received = new ArrayList<>();

        StepVerifier.create(support.chunkedSum(List.<String>of(), 100, chunk -> {
                    received.add(chunk);
                    return Mono.just(1L);
                }))
                .expectNext(0L)
                .verifyComplete();

        assertThat(received).isEmpty();
    }

    @DisplayName("집계 행 250개를 100개씩 순서대로 나누어 처리하고 결과를 합산하는지 검증")
    @Test
    void chunkedSum_splitsAggregationRowsInOrder() {
        // given
        List<Integer> rows = new ArrayList<>();
        for (int i = 0; i < 250; i++) rows.add(i);
        List<Integer> sizes = new ArrayList<>();
        List<Integer> firsts = new ArrayList<>();

        Function<List<Integer>, Mono<Long>> insertOnce = chunk -> {
            sizes.add(chunk.size());
            firsts.add(chunk.get(0));
            return Mono.just((long) chunk.size());
        };

        // when / then
        StepVerifier.create(support.chunkedSum(rows, 100, insertOnce))
                .expectNext(250L)
                .verifyComplete();

        assertThat(sizes).containsExactly(100, 100, 50);
        assertThat(firsts).containsExactly(0, 100, 200);
    }

    @DisplayName("bindOrNull이 값이 있으면 bind, null이면 bindNull을 호출하는지 검증")
    @Test
    void bindOrNull_bindsValueOrNull() {
        DatabaseClient.GenericExecuteSpec spec = Mockito.mock(DatabaseClient.GenericExecuteSpec.class);
        Mockito.when(spec.bind(Mockito.anyString(), Mockito.any())).thenReturn(spec);
        Mockito.when(spec.bindNull(Mockito.anyString(), Mockito.any())).thenReturn(spec);

        support.bindOrNull(spec, "g0", "day", String.class);
        support.bindOrNull(spec, "g1", null, String.class);

        Mockito.verify(spec).bind("g0", "day");
        Mockito.verify(spec).bindNull("g1", String.class);
    }

    @DisplayName("시각이 UTC LocalDateTime으로 저장되고 같은 Instant로 복원되는지 검증")
    @Test
    void toDbFromDb_roundTripsInUtc() {
        Instant playedAt = Instant.parse("2024-03-10T23:30:15.123Z");

        LocalDateTime stored = BatchSqlSupport.toDb(playedAt);

        assertThat(stored).isEqualTo(LocalDateTime.of(2024, 3, 10, 23, 30, 15, 123_000_000));
        assertThat(BatchSqlSupport.fromDb(stored)).isEqualTo(playedAt);
        assertThat(BatchSqlSupport.toDb(null)).isNull();
        assertThat(BatchSqlSupport.fromDb(null)).isNull();
    }

    @DisplayName("드라이버별 집계 결과 타입(Long/BigDecimal/Integer/null)을 long으로 읽는지 검증")
    @Test
    void asLong_readsAnyNumber() {
        assertThat(BatchSqlSupport.asLong(7L)).isEqualTo(7L);
        assertThat(BatchSqlSupport.asLong(new BigDecimal("3000"))).isEqualTo(3000L);
        assertThat(BatchSqlSupport.asLong(2)).isEqualTo(2L);
        assertThat(BatchSqlSupport.asLong(null)).isZero();
    }
}
