package com.musicinsights.librarysync.application.sync.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 동기화 실행 1회의 최종 결과.
 *
 * @param state        종료 상태(DONE/FAILED/CANCELLED)
 * @param failedStep   실패한 단계(FAILED일 때만)
 * @param failure      실패 원인 메시지(FAILED일 때만)
 * @param syncReport   reconcile 결과(reconcile 전 실패면 null)
 * @param mirrorReport 미러 결과(미러 단계를 건너뛰었거나 실패하면 null)
 * @param mirrorError  미러 단계 실패 원인(성공/생략이면 null)
 * @param startedAt    시작 시각
 * @param finishedAt   종료 시각
 */
public record SyncRunResult(
        RunState state,
        RunState failedStep,
        String failure,
        SyncReport syncReport,
        MirrorReport mirrorReport,
        String mirrorError,
        Instant startedAt,
        Instant finishedAt
) {
    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
