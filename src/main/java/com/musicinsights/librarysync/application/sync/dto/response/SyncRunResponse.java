package com.musicinsights.librarysync.application.sync.dto.response;

import com.musicinsights.librarysync.application.sync.model.MirrorReport;
import com.musicinsights.librarysync.application.sync.model.SyncError;
import com.musicinsights.librarysync.application.sync.model.SyncReport;
import com.musicinsights.librarysync.application.sync.model.SyncRunResult;

import java.time.Instant;
import java.util.List;

/**
 * 동기화 실행 결과 응답 DTO.
 *
 * @param state       종료 상태
 * @param failedStep  실패한 단계(실패가 아니면 null)
 * @param failure     실패 원인
 * @param created     생성 수
 * @param updated     변경 수
 * @param removed     삭제 수
 * @param errors      아이템 오류 목록
 * @param mirror      미러 결과(없으면 null)
 * @param mirrorError 미러 실패 원인
 * @param startedAt   시작 시각
 * @param finishedAt  종료 시각
 */
public record SyncRunResponse(
        String state,
        String failedStep,
        String failure,
        long created,
        long updated,
        long removed,
        List<SyncError> errors,
        MirrorReport mirror,
        String mirrorError,
        Instant startedAt,
        Instant finishedAt
) {
    public static SyncRunResponse from(SyncRunResult r) {
        SyncReport report = r.syncReport();
        return new SyncRunResponse(
                r.state().name(),
                r.failedStep() == null ? null : r.failedStep().name(),
                r.failure(),
                report == null ? 0 : report.created(),
                report == null ? 0 : report.updated(),
                report == null ? 0 : report.removed(),
                report == null ? List.of() : report.errors(),
                r.mirrorReport(),
                r.mirrorError(),
                r.startedAt(),
                r.finishedAt()
        );
    }
}
