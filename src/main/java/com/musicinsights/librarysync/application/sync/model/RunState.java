package com.musicinsights.librarysync.application.sync.model;

/**
 * 동기화 실행 상태.
 * <p>
 * {@code IDLE → FETCHING → RECONCILING → MIRROR_UPDATING → DONE},
 * 종료 전 어느 단계에서든 {@code FAILED}, reconcile 중 취소 요청 시 {@code CANCELLED}.
 */
public enum RunState {
    IDLE,
    FETCHING,
    RECONCILING,
    MIRROR_UPDATING,
    DONE,
    FAILED,
    CANCELLED
}
