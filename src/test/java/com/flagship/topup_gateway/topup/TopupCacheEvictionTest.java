package com.flagship.topup_gateway.topup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.topup_gateway.card.Card;
import com.flagship.topup_gateway.notification.EmailTemplateRenderer;
import com.flagship.topup_gateway.observability.TopupMetrics;
import com.flagship.topup_gateway.topup.dto.CreateTopupRequest;
import com.flagship.topup_gateway.topup.dto.TopupResponse;
import com.flagship.topup_gateway.topup.dto.UpdateTopupRequest;
import com.flagship.topup_gateway.topup.exception.TopupException;
import com.flagship.topup_gateway.topup.exception.TopupRollbackException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Cached reads after a failed UpdateTopup, with Redis replaced by a map.
 */
class TopupCacheEvictionTest {

    private static final String CARD = "4111111111111111";

    private final Map<String, String> redis = new ConcurrentHashMap<>();

    private InMemoryLedgers ledgers;
    private TopupCommandService commands;
    private TopupQueryService queries;
    private long topupId;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        ValueOperations<String, String> valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenAnswer(inv -> redis.get(inv.<String>getArgument(0)));
        doAnswer(inv -> {
            redis.put(inv.getArgument(0), inv.getArgument(1));
            return null;
        }).when(valueOperations).set(anyString(), anyString(), any(Duration.class));
        when(redisTemplate.delete(anyString())).thenAnswer(inv -> redis.remove(inv.<String>getArgument(0)) != null);

        ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        TopupCache cache = new TopupCache(Optional.of(redisTemplate), objectMapper, Duration.ofMinutes(5));
        TopupMetrics metrics = new TopupMetrics(new SimpleMeterRegistry());

        ledgers = new InMemoryLedgers();
        ledgers.cards.put(new Card(1L, 10L, CARD, "debit", "2030-12-31", "123", "visa", "alice@example.com"));
        ledgers.saldos.put(CARD, 100_000L);

        commands = new TopupCommandService(ledgers.cards, ledgers.saldos, ledgers.topups, ledgers.publisher,
            new EmailTemplateRenderer(), cache, new CardLockRegistry(16), metrics,
            "email-service-topic-topup-create", "Topup Successful - SanEdge",
            "https://sanedge.example.com/topup/history");
        queries = new TopupQueryService(ledgers.topups, cache, metrics);

        topupId = commands.createTopup(new CreateTopupRequest(CARD, 50_000L, "bank_transfer"), null).getId();
        assertEquals(TopupStatus.SUCCESS, queries.findById(topupId).getStatus());
        assertTrue(redis.containsKey(TopupCache.keyFor(topupId)));
    }

    private UpdateTopupRequest update(long amount) {
        return new UpdateTopupRequest(topupId, CARD, amount, "virtual_account");
    }

    @Test
    @DisplayName("failed saldo write drops the cached success so the next read sees the failure")
    void saldoWriteFailureEvicts() {
        ledgers.failOn("updateSaldoBalance", new DataAccessResourceFailureException("connection refused"));

        assertThrows(TopupException.class, () -> commands.updateTopup(update(80_000L)));

        assertFalse(redis.containsKey(TopupCache.keyFor(topupId)));
        TopupResponse read = queries.findById(topupId);
        assertEquals(TopupStatus.FAILED, read.getStatus());
        assertEquals(50_000L, read.getTopupAmount());
    }

    @Test
    @DisplayName("failed rollback still drops the cached entry")
    void rollbackFailureEvicts() {
        ledgers.failOn("updateSaldoBalance", new DataAccessResourceFailureException("connection refused"));
        ledgers.failOn("updateTopupAmount", new DataAccessResourceFailureException("rollback refused"));

        assertThrows(TopupRollbackException.class, () -> commands.updateTopup(update(80_000L)));

        TopupResponse read = queries.findById(topupId);
        assertEquals(TopupStatus.FAILED, read.getStatus());
        assertEquals(80_000L, read.getTopupAmount());
    }

    @Test
    @DisplayName("failed success mark after the saldo write drops the cached entry")
    void successMarkFailureEvicts() {
        ledgers.failOn("updateTopupStatus:success", new DataAccessResourceFailureException("connection refused"));

        assertThrows(TopupException.class, () -> commands.updateTopup(update(80_000L)));

        TopupResponse read = queries.findById(topupId);
        assertEquals(TopupStatus.FAILED, read.getStatus());
        assertEquals(80_000L, read.getTopupAmount());
    }

    @Test
    @DisplayName("successful update replaces the cached amount")
    void successfulUpdateEvicts() {
        commands.updateTopup(update(80_000L));

        TopupResponse read = queries.findById(topupId);
        assertEquals(TopupStatus.SUCCESS, read.getStatus());
        assertEquals(80_000L, read.getTopupAmount());
    }
}
