package com.musicinsights.librarysync.infrastructure.persistence.r2dbc;

/**
 * playlist_track 연결 요청의 처리 결과.
 */
public enum LinkOutcome {
    /** 새 연결 행이 생성됨 */
    CREATED,
    /** 기존 연결의 위치만 덮어씀 */
    REPOSITIONED,
    /** 이미 같은 위치로 연결되어 있어 쓰기 없음 */
    UNCHANGED
}
