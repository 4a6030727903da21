package com.flagship.accounting_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.accounting_ledger.account.Account;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AccountCreatedEvent implements LedgerEvent {

    public static final String EVENT_TYPE = "AccountCreated";

    UUID eventId;
    String code;
    String name;
    String accountType;
    String normalBalanceSide;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public String getAggregateId() {
        return code;
    }

    public static AccountCreatedEvent from(Account account) {
        return new AccountCreatedEvent(
            UUID.randomUUID(),
            account.getCode(),
            account.getName(),
            account.getType().name(),
            account.getNormalBalanceSide().name(),
            account.getCreatedAt()
        );
    }
}
