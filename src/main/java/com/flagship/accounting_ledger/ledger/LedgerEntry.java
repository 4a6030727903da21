package com.flagship.accounting_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * One line of an account's ledger with the account balance right after it.
 * The balance is signed by the account's normal side.
 */
@Value
public class LedgerEntry {
    long entryId;
    int lineNumber;
    Instant createdAt;
    String entryDescription;
    String lineDescription;
    long debit;
    long credit;
    long runningBalance;
}
