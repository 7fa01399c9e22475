package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * R2DBC 환경의 Reactive 트랜잭션 설정.
 * <p>
 * 요약 upsert와 집계 결과의 "삭제 후 삽입" 교체를 하나의 트랜잭션으로 묶기 위해
 * {@link TransactionalOperator}를 Bean으로 등록합니다.
 * 청취 이벤트 chunk 쓰기는 부분 성공을 그대로 남기므로 트랜잭션으로 묶지 않습니다.
 */
@Configuration
public class R2dbcTxConfig {

    @Bean
    public ReactiveTransactionManager reactiveTransactionManager(ConnectionFactory cf) {
        return new R2dbcTransactionManager(cf);
    }

    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager tm) {
        return TransactionalOperator.create(tm);
    }
}
