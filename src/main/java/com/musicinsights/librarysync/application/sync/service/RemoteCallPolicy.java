package com.musicinsights.librarysync.application.sync.service;

import com.musicinsights.librarysync.application.sync.remote.RemoteCatalogException;
import com.musicinsights.librarysync.infrastructure.config.LibrarySyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 원격 카탈로그 호출에 timeout과 제한된 지수 backoff 재시도를 적용한다.
 * <p>
 * 재시도 대상은 timeout과 {@link RemoteCatalogException#isTransient()}가 true인 실패뿐이다.
 * 재시도가 모두 소진되면 마지막 실패를 그대로 전파한다.
 */
@Component
public class RemoteCallPolicy {
    private static final Logger log = LoggerFactory.getLogger(RemoteCallPolicy.class);

    private final Duration timeout;
    private final int maxRetries;
    private final Duration backoff;

    public RemoteCallPolicy(LibrarySyncProperties props) {
        this.timeout = props.remote().timeout();
        this.maxRetries = Math.max(0, props.remote().maxRetries());
        this.backoff = props.remote().retryBackoff();
    }

    /**
     * 원격 호출 하나를 정책으로 감싼다.
     * <p>
     * 재시도마다 supplier를 다시 호출하므로, 호출은 구독 시점에 시작되어야 한다.
     *
     * @param call      원격 호출
     * @param operation 로그용 연산 이름
     * @param <T>       결과 타입
     * @return 정책이 적용된 호출
     */
    public <T> Mono<T> call(Supplier<Mono<T>> call, String operation) {
        return Mono.defer(call)
                .timeout(timeout)
                .retryWhen(Retry.backoff(maxRetries, backoff)
                        .filter(RemoteCallPolicy::isTransient)
                        .doBeforeRetry(s -> log.warn("remote {} failed (attempt {}), retrying: {}",
                                operation, s.totalRetries() + 1, s.failure().toString()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof TimeoutException) return true;
        return e instanceof RemoteCatalogException r && r.isTransient();
    }
}
