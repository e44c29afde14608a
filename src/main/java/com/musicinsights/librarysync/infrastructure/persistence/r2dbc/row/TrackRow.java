package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row;

/**
 * track 테이블의 한 행을 표현하는 Row 객체입니다.
 *
 * @param id         store가 부여한 트랙 식별자
 * @param externalId 원격 카탈로그의 안정적인 트랙 식별자 (실행 간 동일성 키)
 * @param name       트랙 제목
 * @param albumId    트랙이 속한 앨범의 식별자
 */
public record TrackRow(
        Long id,
        String externalId,
        String name,
        Long albumId
) {}
