package com.musicinsights.librarysync.infrastructure.input.ndjson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * NDJSON 파일을 "한 줄씩" 읽기 위한 라인 리더입니다.
 * <p>
 * {@link BufferedReader#lines()}의 lazy 스트림을 이용해 메모리 사용량을 최소화하며,
 * 리소스 생성/사용/해제를 {@link Flux#using}으로 관리합니다.
 * <p>
 * 파일 I/O는 blocking 작업이므로 {@link Schedulers#boundedElastic()}에서 실행합니다.
 */
@Component
public class NdjsonLineReader {
    private static final Logger log = LoggerFactory.getLogger(NdjsonLineReader.class);

    /**
     * 파일을 한 줄씩 {@link Flux}로 반환합니다. 빈 줄은 건너뜁니다.
     * <p>
     * 파일이 없으면 빈 Flux를 반환합니다.
     *
     * @param file NDJSON 파일 경로
     * @return 파일의 각 라인을 순차적으로 방출하는 Flux
     */
    public Flux<String> readLines(Path file) {
        return Flux.defer(() -> {
                    if (!Files.exists(file)) {
                        log.debug("ndjson file {} not found, reading as empty", file);
                        return Flux.<String>empty();
                    }
                    return Flux.using(
                            () -> Files.newBufferedReader(file, StandardCharsets.UTF_8),
                            br -> Flux.fromStream(br.lines()),
                            br -> {
                                try {
                                    br.close();
                                } catch (IOException e) {
                                    log.warn("failed to close {}: {}", file, e.getMessage());
                                }
                            }
                    );
                })
                .filter(line -> !line.isBlank())
                .subscribeOn(Schedulers.boundedElastic()); // blocking IO는 elastic으로
    }
}
