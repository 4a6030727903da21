package com.flagship.accounting_ledger.report;

import lombok.Value;

/**
 * One account's contribution to a statement total, signed by the account's normal side.
 */
@Value
public class AccountAmount {
    String accountCode;
    String accountName;
    long amount;
}
