package com.flagship.accounting_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every event the ledger publishes through the outbox.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    /**
     * Journal entry id or account code the event is about; used as the Kafka key.
     */
    String getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
