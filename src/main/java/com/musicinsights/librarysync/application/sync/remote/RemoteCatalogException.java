package com.musicinsights.librarysync.application.sync.remote;

/**
 * 원격 카탈로그 호출(전송) 실패.
 *
 * <p>{@code transientFailure}가 true인 실패(레이트 리밋, 일시적 네트워크 오류 등)만 재시도 대상이다.</p>
 */
public class RemoteCatalogException extends RuntimeException {
    private final boolean transientFailure;

    public RemoteCatalogException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public RemoteCatalogException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * 재시도할 가치가 있는 일시적 실패인지 반환한다.
     *
     * @return 일시적 실패면 true
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
