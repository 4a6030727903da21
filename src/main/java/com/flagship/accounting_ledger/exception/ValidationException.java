package com.flagship.accounting_ledger.exception;

import lombok.Getter;

/**
 * Thrown when a request violates a ledger rule. Nothing has been persisted when this is thrown.
 */
@Getter
public class ValidationException extends AccountingException {

    private final ValidationFailure failure;

    public ValidationException(ValidationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }
}
