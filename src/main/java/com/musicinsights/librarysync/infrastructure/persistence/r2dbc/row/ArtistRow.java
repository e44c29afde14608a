package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row;

/**
 * artist 테이블의 한 행을 표현하는 Row 객체입니다.
 *
 * @param id        store가 부여한 아티스트 식별자
 * @param artistKey get-or-create에 쓰는 자연키(원격 id 또는 정규화된 이름)
 * @param name      표시용 아티스트 이름
 * @param userSaved 원격 라이브러리에서 사용자가 저장(구독)한 아티스트인지 여부
 */
public record ArtistRow(
        Long id,
        String artistKey,
        String name,
        boolean userSaved
) {}
