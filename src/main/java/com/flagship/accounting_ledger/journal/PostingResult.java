package com.flagship.accounting_ledger.journal;

import lombok.Value;

/**
 * Outcome of a posting: the committed entry, and whether this call created it or
 * replayed an earlier call with the same client reference.
 */
@Value
public class PostingResult {
    JournalEntry entry;
    boolean created;

    public static PostingResult created(JournalEntry entry) {
        return new PostingResult(entry, true);
    }

    public static PostingResult replayed(JournalEntry entry) {
        return new PostingResult(entry, false);
    }
}
