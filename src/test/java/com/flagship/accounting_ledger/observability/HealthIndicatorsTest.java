package com.flagship.accounting_ledger.observability;

import com.flagship.accounting_ledger.integrity.LedgerIntegrityMonitor;
import com.flagship.accounting_ledger.outbox.OutboxEventRepository;
import com.flagship.accounting_ledger.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthIndicatorsTest {

    @Test
    @DisplayName("Integrity health goes DOWN with the latched violation")
    void testLedgerIntegrityHealth() {
        LedgerIntegrityMonitor monitor = new LedgerIntegrityMonitor(
            new SimpleMeterRegistry(), new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
        HealthIndicators.LedgerIntegrityHealthIndicator indicator =
            new HealthIndicators.LedgerIntegrityHealthIndicator(monitor);

        assertEquals(Status.UP, indicator.health().getStatus());

        monitor.recordViolation("Trial balance identity", "debits 100 != credits 90");
        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Trial balance identity", health.getDetails().get("identity"));
        assertEquals(true, health.getDetails().get("correctionsHalted"));
    }

    @Test
    @DisplayName("Outbox health follows the backlog thresholds")
    void testOutboxHealth() {
        OutboxEventRepository repository = mock(OutboxEventRepository.class);
        HealthIndicators.OutboxHealthIndicator indicator = new HealthIndicators.OutboxHealthIndicator(repository, 5);

        when(repository.countUnpublishedByAggregateType()).thenReturn(backlog(2L, 1L));
        Health healthy = indicator.health();
        assertEquals(Status.UP, healthy.getStatus());
        assertEquals(3L, healthy.getDetails().get("backlogSize"));

        when(repository.countUnpublishedByAggregateType()).thenReturn(backlog(4_000L, 1_000L));
        assertEquals("WARNING", indicator.health().getStatus().getCode());

        when(repository.countUnpublishedByAggregateType()).thenReturn(backlog(15_000L, 0L));
        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    @DisplayName("A dead-lettered event raises a warning even with a small backlog")
    void testOutboxDeadLetter() {
        OutboxEventRepository repository = mock(OutboxEventRepository.class);
        when(repository.countUnpublishedByAggregateType()).thenReturn(backlog(1L, 0L));
        when(repository.countDeadLetters(5)).thenReturn(1L);

        Health health = new HealthIndicators.OutboxHealthIndicator(repository, 5).health();

        assertEquals("WARNING", health.getStatus().getCode());
        assertEquals(1L, health.getDetails().get("deadLettered"));
    }

    @Test
    @DisplayName("Kafka health is UNKNOWN when this instance does not publish")
    @SuppressWarnings("unchecked")
    void testKafkaWithoutPublisher() {
        KafkaTemplate<String, String> template = mock(KafkaTemplate.class);

        Health health = new HealthIndicators.KafkaHealthIndicator(template, false).health();

        assertEquals(Status.UNKNOWN, health.getStatus());
    }

    private static List<Object[]> backlog(long journalEntries, long accounts) {
        return List.of(new Object[] {"JournalEntry", journalEntries}, new Object[] {"Account", accounts});
    }

    @Test
    @DisplayName("Redis outage degrades instead of failing")
    void testRedisDegraded() {
        StringRedisTemplate template = mock(StringRedisTemplate.class);
        RedisConnectionFactory factory = mock(RedisConnectionFactory.class);
        when(template.getConnectionFactory()).thenReturn(factory);
        when(factory.getConnection()).thenThrow(new IllegalStateException("Connection refused"));

        Health health = new HealthIndicators.RedisHealthIndicator(Optional.of(template)).health();

        assertEquals("DEGRADED", health.getStatus().getCode());
        assertEquals("Connection refused", health.getDetails().get("error"));
    }

    @Test
    @DisplayName("Missing Redis degrades")
    void testRedisMissing() {
        Health health = new HealthIndicators.RedisHealthIndicator(Optional.empty()).health();

        assertEquals("DEGRADED", health.getStatus().getCode());
    }
}
