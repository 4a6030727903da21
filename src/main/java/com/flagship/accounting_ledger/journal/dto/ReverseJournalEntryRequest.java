package com.flagship.accounting_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ReverseJournalEntryRequest {

    @Size(max = 255, message = "Client reference must be at most 255 characters")
    @JsonProperty("client_ref")
    String clientRef;
}
