package com.flagship.accounting_ledger.journal;

import lombok.Value;

/**
 * Sum of the debit and credit lines posted to one account over some window.
 */
@Value
public class AccountTotals {
    String accountCode;
    long debitTotal;
    long creditTotal;
}
