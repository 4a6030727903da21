package com.flagship.accounting_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.journal.JournalEntry;
import com.flagship.accounting_ledger.journal.JournalLine;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("client_ref")
    String clientRef;

    @JsonProperty("reverses_entry_id")
    Long reversesEntryId;

    @JsonProperty("total_debits")
    long totalDebits;

    @JsonProperty("total_credits")
    long totalCredits;

    @JsonProperty("lines")
    List<LineResponse> lines;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .description(entry.getDescription())
            .createdAt(entry.getCreatedAt())
            .clientRef(entry.getClientRef())
            .reversesEntryId(entry.getReversesEntryId())
            .totalDebits(entry.getTotalDebits())
            .totalCredits(entry.getTotalCredits())
            .lines(entry.getLines().stream().map(LineResponse::from).toList())
            .build();
    }

    @Value
    public static class LineResponse {

        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("account_code")
        String accountCode;

        @JsonProperty("debit")
        long debit;

        @JsonProperty("credit")
        long credit;

        @JsonProperty("description")
        String description;

        static LineResponse from(JournalLine line) {
            return new LineResponse(line.getLineNumber(), line.getAccountCode(),
                line.getDebit(), line.getCredit(), line.getDescription());
        }
    }
}
