package com.flagship.accounting_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.account.BalanceSide;
import lombok.Value;

@Value
public class AccountBalanceResponse {

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("normal_balance_side")
    BalanceSide normalBalanceSide;

    /**
     * Signed in the account's normal direction, minor units.
     */
    @JsonProperty("balance")
    long balance;
}
