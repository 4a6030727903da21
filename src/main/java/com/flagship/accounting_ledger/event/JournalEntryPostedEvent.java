package com.flagship.accounting_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.accounting_ledger.journal.JournalEntry;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published once per committed journal entry, reversals included.
 */
@Value
public class JournalEntryPostedEvent implements LedgerEvent {

    public static final String EVENT_TYPE = "JournalEntryPosted";

    UUID eventId;
    long entryId;
    String description;
    String clientRef;
    Long reversesEntryId;
    List<Line> lines;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public String getAggregateId() {
        return String.valueOf(entryId);
    }

    public static JournalEntryPostedEvent from(JournalEntry entry) {
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getDescription(),
            entry.getClientRef(),
            entry.getReversesEntryId(),
            entry.getLines().stream()
                .map(line -> new Line(line.getAccountCode(), line.getDebit(), line.getCredit()))
                .toList(),
            entry.getCreatedAt()
        );
    }

    @Value
    public static class Line {
        String accountCode;
        long debit;
        long credit;
    }
}
