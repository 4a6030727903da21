package com.flagship.accounting_ledger.account;

import lombok.Value;

import java.time.Instant;

/**
 * An entry in the chart of accounts.
 * The code is the immutable key other components hold; accounts are retired by
 * clearing {@code active}, never deleted.
 */
@Value
public class Account {
    String code;
    String name;
    AccountType type;
    boolean active;
    String description;
    Instant createdAt;

    public BalanceSide getNormalBalanceSide() {
        return type.getNormalBalanceSide();
    }

    public Account deactivate() {
        return new Account(code, name, type, false, description, createdAt);
    }
}
