package com.musicinsights.librarysync.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * {@code library-sync.*} 설정 값.
 *
 * @param mirror 미러 플레이리스트 설정
 * @param remote 원격 카탈로그 호출 정책
 * @param export 라이브러리 export 디렉터리 설정
 */
@ConfigurationProperties(prefix = "library-sync")
public record LibrarySyncProperties(
        @DefaultValue Mirror mirror,
        @DefaultValue Remote remote,
        @DefaultValue Export export
) {

    /**
     * @param enabled       실행 시 미러 단계를 수행할지 기본값
     * @param title         예약된 미러 플레이리스트 제목
     * @param pushChunkSize 원격 add 호출 한 번에 보낼 최대 트랙 수
     */
    public record Mirror(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("ytmb-all") String title,
            @DefaultValue("50") int pushChunkSize
    ) {}

    /**
     * @param timeout          원격 호출 1회의 제한 시간
     * @param maxRetries       일시적 실패에 대한 최대 재시도 횟수
     * @param retryBackoff     첫 재시도 대기 시간(지수 증가)
     * @param fetchConcurrency 플레이리스트 트랙 동시 조회 수
     */
    public record Remote(
            @DefaultValue("30s") Duration timeout,
            @DefaultValue("3") int maxRetries,
            @DefaultValue("500ms") Duration retryBackoff,
            @DefaultValue("4") int fetchConcurrency
    ) {}

    /**
     * @param directory NDJSON export 파일이 있는 디렉터리
     */
    public record Export(
            @DefaultValue("./library-export") String directory
    ) {}
}
