package com.musicinsights.librarysync.application.sync.service;

import com.musicinsights.librarysync.application.sync.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * fetch → reconcile → mirror → report 순서로 동기화 1회를 실행하는 서비스입니다.
 * <p>
 * 프로세스당 한 번에 하나의 실행만 허용합니다. 실행 결과는 항상 {@link SyncRunResult}로 돌려주며,
 * 실패도 예외가 아니라 {@link RunState#FAILED} 결과로 표현합니다(동시 실행 거절만 예외).
 */
@Service
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    /** 보관할 최근 실행 결과 수 */
    static final int HISTORY_SIZE = 20;

    private final RemoteSnapshotFetcher fetcher;
    private final LibraryReconciler reconciler;
    private final MirrorPlaylistBuilder mirrorBuilder;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final AtomicReference<SyncCancellation> current = new AtomicReference<>();
    private final Deque<SyncRunResult> history = new ArrayDeque<>();

    public SyncOrchestrator(
            RemoteSnapshotFetcher fetcher,
            LibraryReconciler reconciler,
            MirrorPlaylistBuilder mirrorBuilder
    ) {
        this.fetcher = fetcher;
        this.reconciler = reconciler;
        this.mirrorBuilder = mirrorBuilder;
    }

    /**
     * 실행 중 진행 상황(현재 단계, reconcile 결과)을 담는다.
     */
    private final class RunInProgress {
        final Instant startedAt = Instant.now();
        final SyncCancellation cancellation = new SyncCancellation();
        volatile RunState step = RunState.IDLE;
        volatile SyncReport syncReport;

        void enter(RunState next) {
            step = next;
            state.set(next);
            log.debug("sync step -> {}", next);
        }

        SyncRunResult done(MirrorReport mirrorReport, String mirrorError) {
            return new SyncRunResult(RunState.DONE, null, null, syncReport, mirrorReport, mirrorError,
                    startedAt, Instant.now());
        }

        SyncRunResult cancelled(MirrorReport mirrorReport) {
            return new SyncRunResult(RunState.CANCELLED, null, null, syncReport, mirrorReport, null,
                    startedAt, Instant.now());
        }

        SyncRunResult failed(Throwable e) {
            log.error("sync failed during {}", step, e);
            return new SyncRunResult(RunState.FAILED, step, describe(e), syncReport, null, null,
                    startedAt, Instant.now());
        }
    }

    /**
     * 동기화를 1회 실행합니다.
     *
     * @param config 실행 설정
     * @return 실행 결과
     * @throws SyncAlreadyRunningException 이미 실행 중인 경우(Mono error)
     */
    public Mono<SyncRunResult> run(SyncRunConfig config) {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                return Mono.error(new SyncAlreadyRunningException());
            }

            RunInProgress run = new RunInProgress();
            current.set(run.cancellation);
            log.info("sync started (mirror={})", config.mirrorEnabled());

            return Mono.defer(() -> {
                        run.enter(RunState.FETCHING);
                        return fetcher.fetch();
                    })
                    .flatMap(snapshot -> {
                        run.enter(RunState.RECONCILING);
                        return reconciler.reconcile(snapshot, run.cancellation);
                    })
                    .flatMap(report -> {
                        run.syncReport = report;
                        if (report.cancelled()) return Mono.just(run.cancelled(null));
                        if (!config.mirrorEnabled()) return Mono.just(run.done(null, null));

                        run.enter(RunState.MIRROR_UPDATING);
                        return mirrorBuilder.ensureMirror(run.cancellation)
                                .map(mirror -> run.cancellation.isRequested()
                                        ? run.cancelled(mirror)
                                        : run.done(mirror, null))
                                .onErrorResume(e -> {
                                    log.warn("mirror update failed: {}", describe(e));
                                    return Mono.just(run.done(null, describe(e)));
                                });
                    })
                    .onErrorResume(e -> Mono.just(run.failed(e)))
                    .map(this::complete)
                    .doFinally(signal -> {
                        if (signal == SignalType.CANCEL) {
                            release(RunState.IDLE);
                        }
                    });
        });
    }

    /**
     * 진행 중인 실행에 취소를 요청합니다.
     *
     * @return 취소를 요청할 실행이 있었으면 true
     */
    public boolean cancel() {
        SyncCancellation c = current.get();
        if (c == null) return false;
        c.request();
        log.info("sync cancellation requested");
        return true;
    }

    public RunState state() {
        return state.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /** 가장 최근에 끝난 실행의 결과 */
    public Optional<SyncRunResult> lastResult() {
        synchronized (history) {
            return Optional.ofNullable(history.peekFirst());
        }
    }

    /**
     * 최근 실행 결과를 최신순으로 반환합니다.
     *
     * @param limit 최대 개수
     * @return 실행 결과 목록
     */
    public List<SyncRunResult> history(int limit) {
        synchronized (history) {
            return new ArrayList<>(history).subList(0, Math.min(limit, history.size()));
        }
    }

    private SyncRunResult complete(SyncRunResult result) {
        synchronized (history) {
            history.addFirst(result);
            while (history.size() > HISTORY_SIZE) history.removeLast();
        }
        release(result.state());
        log.info("sync finished: state={}, duration={}ms", result.state(), result.duration().toMillis());
        return result;
    }

    private void release(RunState finalState) {
        state.set(finalState);
        current.set(null);
        running.set(false);
    }

    private static String describe(Throwable e) {
        String msg = e.getMessage();
        return msg == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + msg;
    }
}
