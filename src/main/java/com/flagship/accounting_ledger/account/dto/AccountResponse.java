package com.flagship.accounting_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.account.Account;
import com.flagship.accounting_ledger.account.AccountType;
import com.flagship.accounting_ledger.account.BalanceSide;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    AccountType type;

    @JsonProperty("normal_balance_side")
    BalanceSide normalBalanceSide;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .code(account.getCode())
            .name(account.getName())
            .type(account.getType())
            .normalBalanceSide(account.getNormalBalanceSide())
            .active(account.isActive())
            .description(account.getDescription())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
