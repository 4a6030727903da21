package com.flagship.accounting_ledger.journal;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Resolves client references to committed journal entries.
 *
 * Redis is a fast path only. The {@code client_ref} unique constraint in the journal is the
 * source of truth, so a stale or missing Redis key never changes the outcome.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:client-ref:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final JournalRepository journalRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(JournalRepository journalRepository,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${ledger.idempotency.redis.enabled:true}") boolean redisEnabled) {
        this.journalRepository = journalRepository;
        this.redisTemplate = redisEnabled ? redisTemplate : Optional.empty();
    }

    /**
     * Finds the entry previously committed under this client reference, if any.
     */
    public Optional<JournalEntry> findExisting(String clientRef) {
        if (clientRef == null) {
            return Optional.empty();
        }

        Optional<Long> cachedId = readCache(clientRef);
        if (cachedId.isPresent()) {
            Optional<JournalEntry> cached = journalRepository.findById(cachedId.get())
                .filter(entry -> clientRef.equals(entry.getClientRef()));
            if (cached.isPresent()) {
                log.debug("Client reference found in Redis: {}", clientRef);
                return cached;
            }
            log.debug("Stale Redis mapping for client reference {}, checking database", clientRef);
        }

        Optional<JournalEntry> existing = journalRepository.findByClientRef(clientRef);
        existing.ifPresent(entry -> remember(clientRef, entry.getId()));
        return existing;
    }

    /**
     * Caches the mapping. Best effort: failures are logged and ignored.
     */
    public void remember(String clientRef, long entryId) {
        if (clientRef == null || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + clientRef, Long.toString(entryId), REDIS_TTL);
            log.debug("Stored client reference in Redis: {} -> {}", clientRef, entryId);
        } catch (RuntimeException e) {
            log.warn("Failed to store client reference {} in Redis: {}", clientRef, e.getMessage());
        }
    }

    private Optional<Long> readCache(String clientRef) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + clientRef);
            return value == null ? Optional.empty() : Optional.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed Redis value for client reference {}", clientRef);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for client reference {}. Falling back to database. Error: {}",
                clientRef, e.getMessage());
            return Optional.empty();
        }
    }
}
