package com.musicinsights.librarysync.bootstrap;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;

/**
 * 애플리케이션 시작 시점에 Flyway 마이그레이션을 실행하는 설정 클래스입니다.
 *
 * <p>{@link ApplicationRunner}를 Bean으로 등록해, 컨텍스트 초기화 직후
 * JDBC datasource 설정을 기반으로 {@link Flyway#migrate()}를 수행합니다.</p>
 *
 * <p>R2DBC 커넥션은 스키마를 만들지 않으므로, 같은 DB를 가리키는 JDBC URL로 마이그레이션한다.
 * {@code local}, {@code test} 프로필에서만 동작한다.</p>
 *
 * <p>주요 설정값:
 * {@code spring.datasource.*}, {@code spring.flyway.locations},
 * {@code spring.flyway.baseline-on-migrate}, {@code spring.flyway.baseline-version}</p>
 */
@Configuration
@Profile({"local", "test"})
public class FlywayRunner {
    private static final Logger log = LoggerFactory.getLogger(FlywayRunner.class);

    /**
     * 애플리케이션 시작 직후 Flyway 마이그레이션을 실행하는 Runner Bean을 생성합니다.
     *
     * @param env application.yml 및 profile 설정을 조회하기 위한 {@link Environment}
     * @return Flyway 마이그레이션을 수행하는 {@link ApplicationRunner}
     */
    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    ApplicationRunner runFlyway(Environment env) {
        return args -> {
            String url = env.getProperty("spring.datasource.url");
            String user = env.getProperty("spring.datasource.username");
            String pass = env.getProperty("spring.datasource.password");

            Flyway flyway = Flyway.configure()
                    .dataSource(url, user, pass)
                    .locations(env.getProperty("spring.flyway.locations", "classpath:db/migration"))
                    .baselineOnMigrate(Boolean.parseBoolean(
                            env.getProperty("spring.flyway.baseline-on-migrate", "false")
                    ))
                    .baselineVersion(env.getProperty("spring.flyway.baseline-version", "0"))
                    .load();

            var result = flyway.migrate();
            log.info("flyway migrate done: executed={}, target={}", result.migrationsExecuted, result.targetSchemaVersion);
        };
    }
}
