package com.flagship.accounting_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.report.AccountAmount;
import lombok.Value;

import java.util.List;

@Value
public class AccountAmountResponse {

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("amount")
    long amount;

    static List<AccountAmountResponse> fromAll(List<AccountAmount> amounts) {
        return amounts.stream()
            .map(amount -> new AccountAmountResponse(
                amount.getAccountCode(), amount.getAccountName(), amount.getAmount()))
            .toList();
    }
}
