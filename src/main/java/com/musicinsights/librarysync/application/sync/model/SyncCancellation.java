package com.musicinsights.librarysync.application.sync.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실행 단위 취소 플래그.
 * <p>
 * reconcile은 새 논리 단위를 시작하기 전에 이 값을 확인한다.
 */
public class SyncCancellation {
    private final AtomicBoolean requested = new AtomicBoolean(false);

    /** 취소를 요청한다. 이미 요청된 상태면 false. */
    public boolean request() {
        return requested.compareAndSet(false, true);
    }

    public boolean isRequested() {
        return requested.get();
    }

    /** 취소되지 않는 토큰 */
    public static SyncCancellation none() {
        return new SyncCancellation();
    }
}
