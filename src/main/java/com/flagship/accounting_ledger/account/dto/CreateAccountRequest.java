package com.flagship.accounting_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * The type is kept as a string so an unknown kind is reported as an
 * UNKNOWN_ACCOUNT_TYPE validation failure rather than a JSON parse error.
 */
@Value
public class CreateAccountRequest {

    @NotBlank(message = "Account code is required")
    @Size(max = 50, message = "Account code must be at most 50 characters")
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Account name is required")
    @Size(max = 255, message = "Account name must be at most 255 characters")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Account type is required")
    @JsonProperty("type")
    String type;

    @JsonProperty("description")
    String description;
}
