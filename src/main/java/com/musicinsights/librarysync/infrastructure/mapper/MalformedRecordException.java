package com.musicinsights.librarysync.infrastructure.mapper;

/**
 * 필수 필드가 빠진 원격 레코드.
 *
 * <p>해당 아이템만 건너뛰고 실행 리포트에 기록된다.</p>
 */
public class MalformedRecordException extends RuntimeException {
    private final String itemRef;

    public MalformedRecordException(String message, String itemRef) {
        super(message);
        this.itemRef = itemRef;
    }

    /**
     * 문제가 된 레코드를 사람이 찾을 수 있게 가리키는 참조(원격 id 또는 이름)를 반환한다.
     *
     * @return 레코드 참조, 알 수 없으면 {@code "?"}
     */
    public String itemRef() {
        return itemRef == null ? "?" : itemRef;
    }
}
