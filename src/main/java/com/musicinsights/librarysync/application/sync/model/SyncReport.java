package com.musicinsights.librarysync.application.sync.model;

import java.util.List;

/**
 * reconcile 결과 요약.
 *
 * @param created   새로 만든 엔티티/연결 행 수
 * @param updated   변경된 이름/앨범/위치/저장 플래그 수
 * @param removed   해제된 연결 행과 정리된 엔티티 수
 * @param errors    아이템 단위 오류
 * @param cancelled 취소 요청으로 중간에 멈췄는지 여부
 */
public record SyncReport(
        long created,
        long updated,
        long removed,
        List<SyncError> errors,
        boolean cancelled
) {
    public SyncReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** 아무 변경도 없었는지 */
    public boolean isNoop() {
        return created == 0 && updated == 0 && removed == 0;
    }
}
