package com.flagship.accounting_ledger.report;

import com.flagship.accounting_ledger.account.AccountType;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Debit and credit totals for every account in the chart, plus grand totals.
 * Only ever built when the grand totals agree.
 */
@Value
public class TrialBalance {
    List<Line> lines;
    long totalDebits;
    long totalCredits;
    Instant generatedAt;

    @Value
    public static class Line {
        String accountCode;
        String accountName;
        AccountType accountType;
        long debitTotal;
        long creditTotal;
        /** Signed by the account's normal side. */
        long balance;
    }
}
