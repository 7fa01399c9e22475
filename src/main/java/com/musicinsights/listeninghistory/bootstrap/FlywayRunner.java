package com.musicinsights.listeninghistory.bootstrap;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;

/**
 * 로컬 실행 시 청취 기록 스키마 마이그레이션을 수행하는 설정 클래스.
 *
 * <p>R2DBC 연결은 Flyway가 사용할 수 없으므로 {@code spring.datasource.*}의 JDBC 정보로
 * {@link Flyway#migrate()}를 실행한다. 스키마는 {@code classpath:db/migration} 아래에 있다.</p>
 */
@Configuration
@Profile("local")
public class FlywayRunner {

    private static final Logger log = LoggerFactory.getLogger(FlywayRunner.class);

    /**
     * 컨텍스트 초기화 직후 마이그레이션을 실행하는 Runner Bean을 생성한다.
     *
     * @param env 설정 조회용 {@link Environment}
     * @return 마이그레이션 Runner
     */
    @Bean
    ApplicationRunner migrateListeningSchema(Environment env) {
        return args -> {
            Flyway flyway = Flyway.configure()
                    .dataSource(
                            env.getProperty("spring.datasource.url"),
                            env.getProperty("spring.datasource.username"),
                            env.getProperty("spring.datasource.password")
                    )
                    .locations(env.getProperty("spring.flyway.locations", "classpath:db/migration"))
                    .baselineOnMigrate(env.getProperty("spring.flyway.baseline-on-migrate", Boolean.class, false))
                    .baselineVersion(env.getProperty("spring.flyway.baseline-version", "0"))
                    .load();

            int applied = flyway.migrate().migrationsExecuted;
            log.info("Flyway migration done. applied={}", applied);
        };
    }
}
