package com.flagship.accounting_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the accounting core.
 *
 * <ul>
 *   <li>ledger.entries.posted: committed journal entries</li>
 *   <li>ledger.entries.rejected: rejected postings, tagged by reason</li>
 *   <li>ledger.idempotency: client reference lookups, tagged hit / miss / conflict</li>
 *   <li>ledger.accounts.created: new accounts</li>
 *   <li>ledger.posting.latency: time to validate and commit an entry</li>
 * </ul>
 */
@Component
public class AccountingMetrics {

    private final MeterRegistry registry;

    private final Counter entriesPosted;
    private final Counter accountsCreated;
    private final Timer postingTimer;

    public AccountingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.entriesPosted = Counter.builder("ledger.entries.posted")
            .description("Number of journal entries committed")
            .register(registry);

        this.accountsCreated = Counter.builder("ledger.accounts.created")
            .description("Number of accounts added to the chart of accounts")
            .register(registry);

        this.postingTimer = Timer.builder("ledger.posting.latency")
            .description("Time taken to validate and commit a journal entry")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    public void recordEntryPosted(long durationMs) {
        entriesPosted.increment();
        postingTimer.record(Duration.ofMillis(durationMs));
    }

    public void recordEntryRejected(String reason) {
        registry.counter("ledger.entries.rejected", "reason", sanitizeTag(reason)).increment();
    }

    public void recordAccountCreated() {
        accountsCreated.increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    public void recordIdempotencyConflict() {
        registry.counter("ledger.idempotency", "result", "conflict").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
