package com.flagship.accounting_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.account.AccountType;
import com.flagship.accounting_ledger.report.TrialBalance;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class TrialBalanceResponse {

    @JsonProperty("accounts")
    List<LineResponse> accounts;

    @JsonProperty("total_debits")
    long totalDebits;

    @JsonProperty("total_credits")
    long totalCredits;

    @JsonProperty("balanced")
    boolean balanced;

    @JsonProperty("generated_at")
    Instant generatedAt;

    public static TrialBalanceResponse from(TrialBalance trialBalance) {
        return TrialBalanceResponse.builder()
            .accounts(trialBalance.getLines().stream().map(LineResponse::from).toList())
            .totalDebits(trialBalance.getTotalDebits())
            .totalCredits(trialBalance.getTotalCredits())
            .balanced(trialBalance.getTotalDebits() == trialBalance.getTotalCredits())
            .generatedAt(trialBalance.getGeneratedAt())
            .build();
    }

    @Value
    public static class LineResponse {

        @JsonProperty("account_code")
        String accountCode;

        @JsonProperty("account_name")
        String accountName;

        @JsonProperty("account_type")
        AccountType accountType;

        @JsonProperty("debit_total")
        long debitTotal;

        @JsonProperty("credit_total")
        long creditTotal;

        @JsonProperty("balance")
        long balance;

        static LineResponse from(TrialBalance.Line line) {
            return new LineResponse(line.getAccountCode(), line.getAccountName(), line.getAccountType(),
                line.getDebitTotal(), line.getCreditTotal(), line.getBalance());
        }
    }
}
