package com.musicinsights.librarysync.infrastructure.persistence.r2dbc;

/**
 * get-or-create 결과.
 *
 * @param row     조회되었거나 새로 생성된 행
 * @param created 이번 호출에서 insert 되었으면 true
 * @param <R>     Row 타입
 */
public record Stored<R>(R row, boolean created) {

    public static <R> Stored<R> created(R row) {
        return new Stored<>(row, true);
    }

    public static <R> Stored<R> existing(R row) {
        return new Stored<>(row, false);
    }
}
