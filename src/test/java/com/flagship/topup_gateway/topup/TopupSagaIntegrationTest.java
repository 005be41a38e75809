package com.flagship.topup_gateway.topup;

import com.flagship.topup_gateway.card.JdbcCardLedgerGateway;
import com.flagship.topup_gateway.config.JacksonConfig;
import com.flagship.topup_gateway.notification.EmailTemplateRenderer;
import com.flagship.topup_gateway.notification.NotificationPublisher;
import com.flagship.topup_gateway.notification.TopupNotification;
import com.flagship.topup_gateway.observability.TopupMetrics;
import com.flagship.topup_gateway.saldo.JdbcSaldoLedgerGateway;
import com.flagship.topup_gateway.topup.dto.CreateTopupRequest;
import com.flagship.topup_gateway.topup.dto.TopupResponse;
import com.flagship.topup_gateway.topup.exception.ErrorKind;
import com.flagship.topup_gateway.topup.exception.TopupException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * End-to-end topup saga over the PostgreSQL-backed gateways. Kafka is
 * replaced by a mock publisher.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({
    JdbcCardLedgerGateway.class,
    JdbcSaldoLedgerGateway.class,
    JpaTopupLedgerGateway.class,
    TopupCommandService.class,
    TopupCache.class,
    CardLockRegistry.class,
    EmailTemplateRenderer.class,
    TopupMetrics.class,
    JacksonConfig.class,
    TopupSagaIntegrationTest.MetricsConfig.class
})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class TopupSagaIntegrationTest {

    private static final String CARD = "4111111111111111";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("topup_gateway_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @TestConfiguration
    static class MetricsConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TopupCommandService commandService;

    @MockBean
    private NotificationPublisher notificationPublisher;

    @BeforeEach
    void seed() {
        jdbcTemplate.execute("TRUNCATE topups, saldos, cards, users RESTART IDENTITY CASCADE");
        Long userId = jdbcTemplate.queryForObject(
            "INSERT INTO users (firstname, lastname, email) VALUES ('Alice', 'Doe', 'alice@example.com') RETURNING user_id",
            Long.class);
        jdbcTemplate.update(
            "INSERT INTO cards (user_id, card_number, card_type, expire_date, cvv, card_provider) " +
            "VALUES (?, ?, 'debit', DATE '2030-12-31', '123', 'visa')",
            userId, CARD);
        jdbcTemplate.update("INSERT INTO saldos (card_number, total_balance) VALUES (?, 100000)", CARD);
    }

    @AfterEach
    void dropFailureTrigger() {
        jdbcTemplate.execute("DROP TRIGGER IF EXISTS reject_saldo_update ON saldos");
        jdbcTemplate.execute("DROP FUNCTION IF EXISTS reject_saldo_update()");
    }

    private long balance() {
        return jdbcTemplate.queryForObject("SELECT total_balance FROM saldos WHERE card_number = ?", Long.class, CARD);
    }

    private String status(long topupId) {
        return jdbcTemplate.queryForObject("SELECT status FROM topups WHERE topup_id = ?", String.class, topupId);
    }

    @Test
    @DisplayName("topup of 50000 on a balance of 100000 ends at 150000 with one notification")
    void successfulTopup() {
        TopupResponse response = commandService.createTopup(new CreateTopupRequest(CARD, 50_000L, "bank_transfer"), null);

        assertEquals(150_000L, balance());
        assertEquals("success", status(response.getId()));
        verify(notificationPublisher, times(1))
            .send(eq("email-service-topic-topup-create"), eq(String.valueOf(response.getId())), any(TopupNotification.class));
    }

    @Test
    @DisplayName("rejected saldo write leaves 100000 and a failed topup")
    void saldoWriteRejected() {
        jdbcTemplate.execute(
            "CREATE FUNCTION reject_saldo_update() RETURNS trigger AS $$ " +
            "BEGIN RAISE EXCEPTION 'saldo writes disabled'; END; $$ LANGUAGE plpgsql");
        jdbcTemplate.execute(
            "CREATE TRIGGER reject_saldo_update BEFORE UPDATE ON saldos " +
            "FOR EACH ROW EXECUTE FUNCTION reject_saldo_update()");

        TopupException e = assertThrows(TopupException.class,
            () -> commandService.createTopup(new CreateTopupRequest(CARD, 50_000L, "bank_transfer"), null));

        assertEquals(ErrorKind.PERSISTENCE_FAILURE, e.getKind());
        assertEquals(100_000L, balance());
        assertEquals("failed", status(1L));
        verify(notificationPublisher, never()).send(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("parallel topups on one card accumulate")
    void parallelTopups() throws Exception {
        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<TopupResponse>> results = new ArrayList<>();
        Callable<TopupResponse> topup =
            () -> commandService.createTopup(new CreateTopupRequest(CARD, 10_000L, "bank_transfer"), null);

        try {
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(topup));
            }
            for (Future<TopupResponse> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(160_000L, balance());
        assertEquals(threads, jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM topups WHERE status = 'success'", Integer.class));
    }
}
