package com.musicinsights.librarysync.application.sync.model;

/**
 * 실행 1회에 대한 설정.
 *
 * @param mirrorEnabled reconcile 후 미러 플레이리스트 단계를 수행할지 여부
 */
public record SyncRunConfig(boolean mirrorEnabled) {}
