package com.musicinsights.librarysync.bootstrap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.env.Environment;

import java.sql.Connection;
import java.sql.DriverManager;

import static org.assertj.core.api.AssertionsForClassTypes.assertThat;

/**
 * FlywayRunner가 실제로 Flyway 마이그레이션을 수행하는지 검증하는 통합 테스트.
 *
 * <p>스프링 컨텍스트에서 {@link ApplicationRunner} 빈을 주입받아 다시 실행하고,
 * JDBC로 {@code flyway_schema_history}와 store 테이블을 조회한다.</p>
 */
@SpringBootTest
class FlywayRunnerTest {

    @Autowired Environment env;

    /** FlywayRunner 설정 클래스에서 등록한 ApplicationRunner 빈 */
    @Autowired ApplicationRunner runFlyway;

    /**
     * 재실행해도 실패하지 않고, 히스토리 테이블에 성공 기록이 남아 있는지 검증한다.
     *
     * @throws Exception JDBC 연결/쿼리 수행 과정에서 발생할 수 있는 예외
     */
    @Test
    @DisplayName("FlywayRunner가 마이그레이션을 수행하고 재실행해도 안전한지 검증")
    void runFlyway() throws Exception {
        runFlyway.run(new DefaultApplicationArguments(new String[0]));

        String url  = env.getProperty("spring.datasource.url");
        String user = env.getProperty("spring.datasource.username");
        String pass = env.getProperty("spring.datasource.password");

        assertThat(url).isNotNull();

        try (Connection conn = DriverManager.getConnection(url, user, pass);
             var st = conn.createStatement()) {
            try (var rs = st.executeQuery("SELECT COUNT(*) FROM flyway_schema_history WHERE success = TRUE")) {
                rs.next();
                assertThat(rs.getInt(1)).isGreaterThanOrEqualTo(1);
            }
            try (var rs = st.executeQuery("SELECT COUNT(*) FROM playlist_track")) {
                rs.next();
                assertThat(rs.getInt(1)).isGreaterThanOrEqualTo(0);
            }
        }
    }
}
