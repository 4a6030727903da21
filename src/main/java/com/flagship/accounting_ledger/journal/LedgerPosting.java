package com.flagship.accounting_ledger.journal;

import lombok.Value;

import java.time.Instant;

/**
 * A journal line joined with its entry header, as read for ledger projections.
 */
@Value
public class LedgerPosting {
    long entryId;
    int lineNumber;
    Instant createdAt;
    String entryDescription;
    String accountCode;
    long debit;
    long credit;
    String lineDescription;
}
