package com.flagship.accounting_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AccountDeactivatedEvent implements LedgerEvent {

    public static final String EVENT_TYPE = "AccountDeactivated";

    UUID eventId;
    String code;
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

    public static AccountDeactivatedEvent of(String code, Instant occurredAt) {
        return new AccountDeactivatedEvent(UUID.randomUUID(), code, occurredAt);
    }
}
