package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row;

/**
 * album 테이블의 한 행을 표현하는 Row 객체입니다.
 *
 * @param id        store가 부여한 앨범 식별자
 * @param albumKey  get-or-create에 쓰는 자연키
 * @param name      앨범명
 * @param userSaved 사용자가 저장한 앨범인지 여부
 */
public record AlbumRow(
        Long id,
        String albumKey,
        String name,
        boolean userSaved
) {}
