package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * R2DBC(WebFlux) 환경에서 entity store의 논리 단위 트랜잭션을 위한 설정 클래스입니다.
 * <p>
 * {@link ReactiveTransactionManager}와 {@link TransactionalOperator}를 Bean으로 등록합니다.
 * 트랜잭션은 Reactor Context를 통해 전달되므로 단위 안의 모든 쿼리가 같은 커넥션을 사용합니다.
 */
@Configuration
public class R2dbcTxConfig {

    /**
     * R2DBC용 트랜잭션 매니저를 생성합니다.
     *
     * @param cf R2DBC {@link ConnectionFactory}
     * @return Reactive 트랜잭션 매니저
     */
    @Bean
    public ReactiveTransactionManager reactiveTransactionManager(ConnectionFactory cf) {
        return new R2dbcTransactionManager(cf);
    }

    /**
     * 논리 단위(트랙 하나, 정리 1회 등)를 감싸는 {@link TransactionalOperator}를 생성합니다.
     * <p>
     * 이미 트랜잭션 안에서 호출되면 바깥 트랜잭션에 참여합니다(PROPAGATION_REQUIRED).
     *
     * @param tm Reactive 트랜잭션 매니저
     * @return 트랜잭션 적용용 operator
     */
    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager tm) {
        DefaultTransactionDefinition def = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRED);
        def.setName("entity-store-unit");
        return TransactionalOperator.create(tm, def);
    }
}
