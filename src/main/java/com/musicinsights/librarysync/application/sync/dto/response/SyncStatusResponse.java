package com.musicinsights.librarysync.application.sync.dto.response;

/**
 * 동기화 상태 응답 DTO.
 *
 * @param state   현재 상태
 * @param running 실행 중 여부
 * @param lastRun 마지막으로 끝난 실행 결과(없으면 null)
 */
public record SyncStatusResponse(String state, boolean running, SyncRunResponse lastRun) {}
