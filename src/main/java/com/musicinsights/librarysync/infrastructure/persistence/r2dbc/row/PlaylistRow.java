package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row;

/**
 * playlist 테이블의 한 행을 표현하는 Row 객체입니다.
 *
 * @param id       store가 부여한 플레이리스트 식별자
 * @param remoteId 원격 카탈로그의 플레이리스트 식별자
 * @param title    플레이리스트 제목
 */
public record PlaylistRow(
        Long id,
        String remoteId,
        String title
) {}
