package com.flagship.accounting_ledger.journal;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A committed, immutable journal entry.
 *
 * Ids increase strictly with each commit and define ledger replay order; {@code createdAt} is
 * drawn under the same append lock, so it never runs against the id order. There is no way to
 * change or remove an entry; a correction is a new entry with {@code reversesEntryId} set.
 */
@Value
public class JournalEntry {
    long id;
    String description;
    Instant createdAt;
    String clientRef;
    Long reversesEntryId;
    List<JournalLine> lines;

    public long getTotalDebits() {
        return lines.stream().mapToLong(JournalLine::getDebit).sum();
    }

    public long getTotalCredits() {
        return lines.stream().mapToLong(JournalLine::getCredit).sum();
    }

    public boolean isReversal() {
        return reversesEntryId != null;
    }
}
