package com.flagship.accounting_ledger.report;

import lombok.Value;

import java.time.Instant;

/**
 * Result of a full integrity verification that passed. A failing check throws instead.
 */
@Value
public class IntegrityReport {
    Instant checkedAt;
    long totalDebits;
    long totalCredits;
    long assets;
    long liabilitiesAndEquity;
    int accountsReconciled;
    /** True if an earlier violation has halted corrections in this process. */
    boolean halted;
}
