package com.flagship.accounting_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accounting_ledger.journal.JournalEntryRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;

/**
 * Body of {@code POST /api/accounting/journal}.
 *
 * Line rules (non-empty, one-sided, known accounts, balanced) are checked by the journal
 * writer so that each violation gets its own failure reason.
 */
@Value
public class CreateJournalEntryRequest {

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @Valid
    @JsonProperty("lines")
    List<LineRequest> lines;

    @Size(max = 255, message = "Client reference must be at most 255 characters")
    @JsonProperty("client_ref")
    String clientRef;

    public JournalEntryRequest toDomain(String clientRefOverride) {
        List<JournalEntryRequest.Line> domainLines = lines == null
            ? List.of()
            : lines.stream().map(line -> line == null ? null : line.toDomain()).toList();
        return new JournalEntryRequest(description, domainLines, clientRefOverride, null);
    }

    /**
     * Amounts are integers in minor units; an omitted side means zero.
     */
    @Value
    public static class LineRequest {

        @JsonProperty("account_code")
        String accountCode;

        @JsonProperty("debit")
        Long debit;

        @JsonProperty("credit")
        Long credit;

        @Size(max = 500, message = "Line description must be at most 500 characters")
        @JsonProperty("description")
        String description;

        JournalEntryRequest.Line toDomain() {
            return new JournalEntryRequest.Line(
                accountCode,
                debit == null ? 0L : debit,
                credit == null ? 0L : credit,
                description
            );
        }
    }
}
