package com.musicinsights.librarysync.application.sync.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 실행 중 누적되는 reconcile 집계.
 * <p>
 * 쓰기는 순차(concatMap)로 일어나지만 스레드가 바뀔 수 있어 synchronized로 보호한다.
 */
public class SyncReportCollector {
    private long created;
    private long updated;
    private long removed;
    private final List<SyncError> errors = new ArrayList<>();

    public synchronized void merge(ChangeTally tally) {
        created += tally.created();
        updated += tally.updated();
        removed += tally.removed();
    }

    public synchronized void error(SyncError error) {
        errors.add(error);
    }

    public synchronized SyncReport toReport(boolean cancelled) {
        return new SyncReport(created, updated, removed, List.copyOf(errors), cancelled);
    }
}
