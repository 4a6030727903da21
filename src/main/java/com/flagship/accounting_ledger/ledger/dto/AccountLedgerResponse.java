package com.flagship.accounting_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.account.AccountType;
import com.flagship.accounting_ledger.account.BalanceSide;
import com.flagship.accounting_ledger.ledger.AccountLedger;
import com.flagship.accounting_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AccountLedgerResponse {

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("normal_balance_side")
    BalanceSide normalBalanceSide;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("entries")
    List<EntryResponse> entries;

    public static AccountLedgerResponse from(AccountLedger ledger) {
        return AccountLedgerResponse.builder()
            .accountCode(ledger.getAccount().getCode())
            .accountName(ledger.getAccount().getName())
            .accountType(ledger.getAccount().getType())
            .normalBalanceSide(ledger.getAccount().getNormalBalanceSide())
            .active(ledger.getAccount().isActive())
            .balance(ledger.getBalance())
            .entries(ledger.getEntries().stream().map(EntryResponse::from).toList())
            .build();
    }

    @Value
    public static class EntryResponse {

        @JsonProperty("entry_id")
        long entryId;

        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("created_at")
        Instant createdAt;

        @JsonProperty("entry_description")
        String entryDescription;

        @JsonProperty("line_description")
        String lineDescription;

        @JsonProperty("debit")
        long debit;

        @JsonProperty("credit")
        long credit;

        @JsonProperty("running_balance")
        long runningBalance;

        static EntryResponse from(LedgerEntry entry) {
            return new EntryResponse(entry.getEntryId(), entry.getLineNumber(), entry.getCreatedAt(),
                entry.getEntryDescription(), entry.getLineDescription(),
                entry.getDebit(), entry.getCredit(), entry.getRunningBalance());
        }
    }
}
