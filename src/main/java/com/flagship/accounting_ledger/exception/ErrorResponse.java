package com.flagship.accounting_ledger.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every accounting endpoint. {@code details} carries the validation
 * reason or per-field messages and is null otherwise.
 */
@Value
@Builder
public class ErrorResponse {
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
