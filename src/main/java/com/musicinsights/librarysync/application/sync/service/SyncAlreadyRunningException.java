package com.musicinsights.librarysync.application.sync.service;

import com.musicinsights.librarysync.application.common.error.ConflictException;

/**
 * 이미 실행 중인 동기화가 있을 때 새 실행 요청을 거절한다.
 */
public class SyncAlreadyRunningException extends ConflictException {
    public SyncAlreadyRunningException() {
        super("A sync run is already in progress", "SYNC_ALREADY_RUNNING");
    }
}
