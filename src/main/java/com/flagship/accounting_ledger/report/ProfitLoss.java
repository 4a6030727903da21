package com.flagship.accounting_ledger.report;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Revenue and expense movements for entries created in {@code [start, end)}.
 * A null bound is open.
 */
@Value
public class ProfitLoss {
    Instant start;
    Instant end;
    long revenueTotal;
    long expenseTotal;
    long netIncome;
    List<AccountAmount> revenues;
    List<AccountAmount> expenses;
}
