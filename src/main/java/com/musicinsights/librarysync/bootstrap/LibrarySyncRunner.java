package com.musicinsights.librarysync.bootstrap;

import com.musicinsights.librarysync.application.sync.model.RunState;
import com.musicinsights.librarysync.application.sync.model.SyncError;
import com.musicinsights.librarysync.application.sync.model.SyncRunConfig;
import com.musicinsights.librarysync.application.sync.model.SyncRunResult;
import com.musicinsights.librarysync.application.sync.service.SyncOrchestrator;
import com.musicinsights.librarysync.infrastructure.config.LibrarySyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * 동기화를 1회 실행하고 결과를 로그로 남기는 {@link CommandLineRunner}.
 *
 * <p>Profile이 {@code sync}일 때만 활성화된다.</p>
 * <p>인자 {@code --no-mirror}를 주면 미러 단계를 건너뛴다.</p>
 */
@Component
@Profile("sync")
public class LibrarySyncRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(LibrarySyncRunner.class);

    /** 동기화 실행 서비스 */
    private final SyncOrchestrator orchestrator;

    /** 미러 기본값 설정 */
    private final LibrarySyncProperties props;

    public LibrarySyncRunner(SyncOrchestrator orchestrator, LibrarySyncProperties props) {
        this.orchestrator = orchestrator;
        this.props = props;
    }

    /**
     * 애플리케이션 시작 시 동기화를 실행하고 끝날 때까지 {@code block()}으로 대기합니다.
     *
     * @param args 커맨드라인 인자
     * @throws IllegalStateException 실행이 FAILED로 끝난 경우
     */
    @Override
    public void run(String... args) {
        boolean mirror = props.mirror().enabled() && Arrays.stream(args).noneMatch("--no-mirror"::equals);

        SyncRunResult result = orchestrator.run(new SyncRunConfig(mirror)).block();
        if (result == null) {
            throw new IllegalStateException("sync run produced no result");
        }

        if (result.syncReport() != null) {
            log.info("created={}, updated={}, removed={}, errors={}",
                    result.syncReport().created(), result.syncReport().updated(),
                    result.syncReport().removed(), result.syncReport().errors().size());
            for (SyncError e : result.syncReport().errors()) {
                log.warn("  {} {}: {}", e.kind(), e.ref(), e.reason());
            }
        }
        if (result.mirrorReport() != null) {
            log.info("mirror added={}, alreadyPresent={}",
                    result.mirrorReport().added(), result.mirrorReport().alreadyPresent());
        }
        if (result.mirrorError() != null) {
            log.warn("mirror step failed: {}", result.mirrorError());
        }
        if (result.state() == RunState.FAILED) {
            throw new IllegalStateException("sync failed during " + result.failedStep() + ": " + result.failure());
        }
    }
}
