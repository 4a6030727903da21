package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.support.InMemoryJournalRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * The Redis fast path may be down or stale; the journal stays the source of truth.
 */
class IdempotencyServiceTest {

    private InMemoryJournalRepository journalRepository;
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private IdempotencyService idempotencyService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        journalRepository = new InMemoryJournalRepository();
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        idempotencyService = new IdempotencyService(journalRepository, Optional.of(redisTemplate), true);
    }

    private JournalEntry commit(String clientRef) {
        return journalRepository.insertIfAbsent(new JournalEntryRequest("Sale",
            List.of(JournalEntryRequest.Line.debit("CASH", 100), JournalEntryRequest.Line.credit("SALES", 100)),
            clientRef, null), Instant.parse("2024-01-01T00:00:00Z")).orElseThrow();
    }

    @Test
    @DisplayName("Cached id is used when it still points at the same client reference")
    void testCacheHit() {
        JournalEntry entry = commit("ref-1");
        when(valueOperations.get("ledger:client-ref:ref-1")).thenReturn(String.valueOf(entry.getId()));

        assertEquals(Optional.of(entry), idempotencyService.findExisting("ref-1"));
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("Stale cached id falls back to the database")
    void testStaleCache() {
        JournalEntry other = commit("ref-other");
        JournalEntry entry = commit("ref-1");
        when(valueOperations.get("ledger:client-ref:ref-1")).thenReturn(String.valueOf(other.getId()));

        assertEquals(Optional.of(entry), idempotencyService.findExisting("ref-1"));
        verify(valueOperations)
            .set(eq("ledger:client-ref:ref-1"), eq(String.valueOf(entry.getId())), any(Duration.class));
    }

    @Test
    @DisplayName("Redis outage falls back to the database")
    void testRedisDown() {
        JournalEntry entry = commit("ref-1");
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        doThrow(new RedisConnectionFailureException("down"))
            .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        assertEquals(Optional.of(entry), idempotencyService.findExisting("ref-1"));
        assertDoesNotThrow(() -> idempotencyService.remember("ref-1", entry.getId()));
    }

    @Test
    @DisplayName("Unknown client reference is a miss")
    void testMiss() {
        assertTrue(idempotencyService.findExisting("never-used").isEmpty());
        assertTrue(idempotencyService.findExisting(null).isEmpty());
    }

    @Test
    @DisplayName("Disabled Redis is never touched")
    void testRedisDisabled() {
        IdempotencyService withoutRedis = new IdempotencyService(journalRepository, Optional.of(redisTemplate), false);
        JournalEntry entry = commit("ref-1");

        assertEquals(Optional.of(entry), withoutRedis.findExisting("ref-1"));
        withoutRedis.remember("ref-1", entry.getId());
        verify(redisTemplate, never()).opsForValue();
    }
}
