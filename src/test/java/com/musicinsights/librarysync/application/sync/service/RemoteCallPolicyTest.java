package com.musicinsights.librarysync.application.sync.service;

import com.musicinsights.librarysync.application.sync.remote.RemoteCatalogException;
import com.musicinsights.librarysync.infrastructure.config.LibrarySyncProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link RemoteCallPolicy} 단위 테스트.
 *
 * <p>재시도 2회, backoff 1ms, timeout 100ms 설정으로 재시도 대상 분류와 소진 시 예외를 검증한다.</p>
 */
@DisplayName("remote call policy 테스트")
class RemoteCallPolicyTest {

    private final RemoteCallPolicy policy = new RemoteCallPolicy(new LibrarySyncProperties(
            new LibrarySyncProperties.Mirror(true, "ytmb-all", 50),
            new LibrarySyncProperties.Remote(Duration.ofMillis(100), 2, Duration.ofMillis(1), 1),
            new LibrarySyncProperties.Export("unused")
    ));

    @Test
    @DisplayName("일시적 실패는 재시도 후 성공하면 값을 반환한다")
    void transientFailure_isRetried() {
        AtomicInteger attempts = new AtomicInteger();

        StepVerifier.create(policy.call(() -> attempts.incrementAndGet() < 3
                                ? Mono.<String>error(new RemoteCatalogException("503", true))
                                : Mono.just("ok"),
                        "test"))
                .expectNext("ok")
                .verifyComplete();

        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("일시적이지 않은 실패는 재시도하지 않는다")
    void permanentFailure_isNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        StepVerifier.create(policy.call(() -> {
                    attempts.incrementAndGet();
                    return Mono.<String>error(new RemoteCatalogException("404", false));
                }, "test"))
                .expectErrorMatches(e -> e instanceof RemoteCatalogException r && !r.isTransient())
                .verify();

        assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("재시도가 소진되면 마지막 원인 예외가 그대로 전파된다")
    void retriesExhausted_propagatesLastFailure() {
        AtomicInteger attempts = new AtomicInteger();

        StepVerifier.create(policy.call(() -> Mono.<String>error(
                        new RemoteCatalogException("503 #" + attempts.incrementAndGet(), true)), "test"))
                .expectErrorMessage("503 #3")
                .verify();
    }

    @Test
    @DisplayName("응답이 없으면 timeout으로 실패하고 재시도된다")
    void slowCall_timesOutAndRetries() {
        AtomicInteger attempts = new AtomicInteger();

        StepVerifier.create(policy.call(() -> {
                    attempts.incrementAndGet();
                    return Mono.<String>never();
                }, "test"))
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("timeout과 transient 원격 예외만 재시도 대상이다")
    void isTransient_classification() {
        assertTrue(RemoteCallPolicy.isTransient(new TimeoutException()));
        assertTrue(RemoteCallPolicy.isTransient(new RemoteCatalogException("x", true)));
        assertFalse(RemoteCallPolicy.isTransient(new RemoteCatalogException("x", false)));
        assertFalse(RemoteCallPolicy.isTransient(new IllegalStateException("x")));
    }
}
