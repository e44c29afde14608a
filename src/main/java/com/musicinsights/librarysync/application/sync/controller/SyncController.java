package com.musicinsights.librarysync.application.sync.controller;

import com.musicinsights.librarysync.application.common.error.NotFoundException;
import com.musicinsights.librarysync.application.sync.dto.response.SyncRunResponse;
import com.musicinsights.librarysync.application.sync.dto.response.SyncStatusResponse;
import com.musicinsights.librarysync.application.sync.model.SyncRunConfig;
import com.musicinsights.librarysync.application.sync.service.SyncOrchestrator;
import com.musicinsights.librarysync.infrastructure.config.LibrarySyncProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 동기화 실행/상태 조회/취소 REST 컨트롤러.
 *
 * <p>실행 자체는 {@link SyncOrchestrator}에 위임한다.</p>
 */
@RestController
@RequestMapping("/api/sync")
@Validated
public class SyncController {
    private final SyncOrchestrator orchestrator;
    private final LibrarySyncProperties props;

    public SyncController(SyncOrchestrator orchestrator, LibrarySyncProperties props) {
        this.orchestrator = orchestrator;
        this.props = props;
    }

    /**
     * 동기화를 1회 실행하고 끝날 때까지 기다려 결과를 반환한다.
     *
     * @param mirror 미러 단계 수행 여부(없으면 설정값)
     * @return 실행 결과, 이미 실행 중이면 409
     */
    @PostMapping
    public Mono<SyncRunResponse> run(@RequestParam(required = false) Boolean mirror) {
        boolean mirrorEnabled = mirror != null ? mirror : props.mirror().enabled();
        return orchestrator.run(new SyncRunConfig(mirrorEnabled))
                .map(SyncRunResponse::from);
    }

    /**
     * 현재 상태와 마지막 실행 결과를 조회한다.
     *
     * @return 상태 응답
     */
    @GetMapping("/status")
    public Mono<SyncStatusResponse> status() {
        return Mono.fromSupplier(() -> new SyncStatusResponse(
                orchestrator.state().name(),
                orchestrator.isRunning(),
                orchestrator.lastResult().map(SyncRunResponse::from).orElse(null)
        ));
    }

    /**
     * 최근 실행 결과를 최신순으로 조회한다.
     *
     * @param limit 조회 개수
     * @return 실행 결과 스트림
     */
    @GetMapping("/history")
    public Flux<SyncRunResponse> history(
            @RequestParam(defaultValue = "10") @Min(1) @Max(20) int limit
    ) {
        return Flux.defer(() -> Flux.fromIterable(orchestrator.history(limit)))
                .map(SyncRunResponse::from);
    }

    /**
     * 진행 중인 실행에 취소를 요청한다.
     *
     * @return 202, 진행 중인 실행이 없으면 404
     */
    @DeleteMapping("/current")
    public Mono<ResponseEntity<Void>> cancel() {
        return Mono.fromSupplier(() -> {
            if (!orchestrator.cancel()) {
                throw new NotFoundException("No sync run is in progress", "NO_ACTIVE_RUN");
            }
            return ResponseEntity.accepted().<Void>build();
        });
    }
}
