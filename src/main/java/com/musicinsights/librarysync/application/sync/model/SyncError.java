package com.musicinsights.librarysync.application.sync.model;

import com.musicinsights.librarysync.infrastructure.mapper.MalformedRecordException;

/**
 * 아이템 단위로 격리된 오류.
 *
 * @param kind   오류 종류({@link #MALFORMED_RECORD}, {@link #ITEM_FAILED})
 * @param ref    문제가 된 아이템 참조(원격 id 또는 이름)
 * @param reason 사람이 읽을 수 있는 원인
 */
public record SyncError(String kind, String ref, String reason) {

    public static final String MALFORMED_RECORD = "MALFORMED_RECORD";
    public static final String ITEM_FAILED = "ITEM_FAILED";

    /**
     * 예외를 아이템 오류로 변환한다.
     *
     * @param e           아이템 처리 중 발생한 예외
     * @param fallbackRef 예외가 참조를 갖고 있지 않을 때 쓸 아이템 참조
     * @return 아이템 오류
     */
    public static SyncError of(Throwable e, String fallbackRef) {
        if (e instanceof MalformedRecordException m) {
            String ref = "?".equals(m.itemRef()) && fallbackRef != null ? fallbackRef : m.itemRef();
            return new SyncError(MALFORMED_RECORD, ref, m.getMessage());
        }
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new SyncError(ITEM_FAILED, fallbackRef == null ? "?" : fallbackRef, reason);
    }
}
