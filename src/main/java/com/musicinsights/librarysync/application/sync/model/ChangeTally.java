package com.musicinsights.librarysync.application.sync.model;

/**
 * 한 논리 단위 안에서 발생한 변경 건수.
 * <p>
 * 단위 트랜잭션이 커밋된 뒤에만 {@link SyncReportCollector}로 합쳐진다.
 */
public class ChangeTally {
    private long created;
    private long updated;
    private long removed;

    public ChangeTally created(long n) {
        created += n;
        return this;
    }

    public ChangeTally updated(long n) {
        updated += n;
        return this;
    }

    public ChangeTally removed(long n) {
        removed += n;
        return this;
    }

    public long created() {
        return created;
    }

    public long updated() {
        return updated;
    }

    public long removed() {
        return removed;
    }
}
