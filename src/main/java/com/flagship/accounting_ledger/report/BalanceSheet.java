package com.flagship.accounting_ledger.report;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Position as of a point in time (inclusive); a null {@code asOf} covers every entry.
 *
 * {@code retainedEarnings} is the net income of every entry up to {@code asOf}, so
 * {@code assets == liabilities + equity + retainedEarnings} always holds for a sound ledger.
 */
@Value
public class BalanceSheet {
    Instant asOf;
    long assets;
    long liabilities;
    long equity;
    long retainedEarnings;
    List<AccountAmount> assetAccounts;
    List<AccountAmount> liabilityAccounts;
    List<AccountAmount> equityAccounts;

    public long getLiabilitiesAndEquity() {
        return liabilities + equity + retainedEarnings;
    }
}
