package com.vtrade.backend.db;

import com.vtrade.backend.repository.InstrumentRepository;
import com.vtrade.backend.repository.RiskAlertRepository;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
class FlywayMigrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("vtrade_test")
            .withUsername("vtrade")
            .withPassword("vtrade");

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");
        registry.add("spring.flyway.enabled", () -> "true");
    }

    @Autowired
    private Flyway flyway;

    @Autowired
    private InstrumentRepository instrumentRepository;

    @Autowired
    private RiskAlertRepository riskAlertRepository;

    @Test
    void migrationsApplyAndMatchEntities() {
        assertThat(flyway.info().applied()).hasSize(3);
        assertThat(riskAlertRepository.count()).isZero();
        assertThat(instrumentRepository.findBySymbolIgnoreCase("reliance")).isPresent();
        assertThat(instrumentRepository.findBySymbolIgnoreCase("NIFTY24DECFUT"))
                .hasValueSatisfying(instrument -> assertThat(instrument.getLotSize()).isEqualTo(25));
    }
}
