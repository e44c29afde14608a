package com.musicinsights.librarysync.infrastructure.persistence.r2dbc;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * entity store Repository들이 공유하는 R2DBC SQL 베이스 클래스입니다.
 * <p>
 * 자연키 기반 get-or-create, 동적 IN 절 바인딩, chunk 단위 순차 실행을 제공합니다.
 * 모든 쿼리는 호출 측의 리액티브 트랜잭션(Reactor Context)에 그대로 참여합니다.
 */
public abstract class StoreSqlSupport {

    /** R2DBC SQL 실행을 위한 DatabaseClient */
    protected final DatabaseClient db;

    /**
     * {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    protected StoreSqlSupport(DatabaseClient db) {
        this.db = db;
    }

    /**
     * 자연키로 먼저 조회하고, 없으면 insert 후 다시 조회합니다.
     * <p>
     * insert가 유니크 제약 위반으로 실패하면(동시 insert 또는 중복 입력) 이미 존재하는 것으로 보고
     * 조회로 폴백합니다. 폴백 조회에서도 행이 없으면 원래 예외를 그대로 전파합니다.
     *
     * @param lookup 자연키 조회(행이 없으면 empty)
     * @param insert 신규 행 insert
     * @param <R>    Row 타입
     * @return 조회/생성된 행과 생성 여부
     */
    protected <R> Mono<Stored<R>> getOrCreate(Supplier<Mono<R>> lookup, Supplier<Mono<Long>> insert) {
        return Mono.defer(lookup)
                .map(Stored::existing)
                .switchIfEmpty(Mono.defer(() -> insert.get()
                        .then(Mono.defer(lookup))
                        .map(Stored::created)
                        .onErrorResume(DataIntegrityViolationException.class, e ->
                                Mono.defer(lookup)
                                        .map(Stored::existing)
                                        .switchIfEmpty(Mono.error(e)))
                ));
    }

    /**
     * 주어진 아이템 목록을 chunk 단위로 분할하여 순차(concat) 처리하고,
     * 각 처리 결과를 합산하여 반환합니다.
     *
     * @param items  처리할 전체 아이템 목록
     * @param chunk  한 번에 처리할 chunk 크기
     * @param onceFn chunk 단위로 실행할 함수(각 chunk에 대한 rowsUpdated 반환)
     * @param <T>    아이템 타입
     * @return 처리된 rowsUpdated 합계
     */
    protected <T> Mono<Long> chunkedSum(
            List<T> items,
            int chunk,
            Function<List<T>, Mono<Long>> onceFn
    ) {
        if (items == null || items.isEmpty()) return Mono.just(0L);
        return Flux.fromIterable(items)
                .buffer(chunk)
                .concatMap(onceFn)
                .reduce(0L, Long::sum);
    }

    /**
     * {@code :p0, :p1, ...} 형태의 IN 절 placeholder 문자열을 만듭니다.
     *
     * @param prefix 파라미터 이름 prefix
     * @param size   값 개수(1 이상)
     * @return placeholder 목록 문자열
     */
    protected static String placeholders(String prefix, int size) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < size; i++) {
            if (i > 0) sb.append(",");
            sb.append(":").append(prefix).append(i);
        }
        return sb.toString();
    }

    /**
     * {@link #placeholders(String, int)}로 만든 IN 절에 값을 순서대로 바인딩합니다.
     *
     * @param spec   바인딩 대상 spec
     * @param prefix 파라미터 이름 prefix
     * @param values 바인딩할 값 목록
     * @return 바인딩이 적용된 spec
     */
    protected static DatabaseClient.GenericExecuteSpec bindAll(
            DatabaseClient.GenericExecuteSpec spec, String prefix, List<?> values
    ) {
        for (int i = 0; i < values.size(); i++) {
            spec = spec.bind(prefix + i, values.get(i));
        }
        return spec;
    }
}
