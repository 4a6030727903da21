package com.flagship.accounting_ledger.ledger;

import com.flagship.accounting_ledger.account.Account;
import lombok.Value;

import java.util.List;

@Value
public class AccountLedger {
    Account account;
    List<LedgerEntry> entries;

    /**
     * Final running balance, zero for an account with no postings.
     */
    public long getBalance() {
        return entries.isEmpty() ? 0L : entries.get(entries.size() - 1).getRunningBalance();
    }
}
