package com.flagship.accounting_ledger.journal;

import lombok.Value;

/**
 * One committed debit or credit line. Exactly one of {@code debit} and {@code credit} is
 * positive, the other is zero; amounts are minor currency units.
 */
@Value
public class JournalLine {
    long entryId;
    int lineNumber;
    String accountCode;
    long debit;
    long credit;
    String description;

    public boolean isDebit() {
        return debit > 0;
    }

    public long getAmount() {
        return isDebit() ? debit : credit;
    }
}
