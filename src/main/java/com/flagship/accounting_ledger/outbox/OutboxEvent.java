package com.flagship.accounting_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox to be published to Kafka.
 *
 * Written in the same transaction as the journal entry or account it describes, then
 * drained asynchronously by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "JournalEntry" or "Account"
    String aggregateId;        // entry id or account code
    String eventType;
    String payload;            // JSON
    String correlationId;      // request that caused the event, if any
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent pending(String aggregateType, String aggregateId, String eventType,
                                      String payload, String correlationId, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            correlationId, createdAt, null, 0, null, null);
    }

    /**
     * True when the next failure will use up the last allowed attempt.
     */
    public boolean isLastAttempt(int maxRetries) {
        return retryCount + 1 >= maxRetries;
    }
}
