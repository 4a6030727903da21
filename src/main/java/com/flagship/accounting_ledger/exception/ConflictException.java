package com.flagship.accounting_ledger.exception;

/**
 * The request collides with something already committed, e.g. a client reference reused
 * with different lines, or a second reversal of the same entry.
 */
public class ConflictException extends AccountingException {

    public ConflictException(String message) {
        super(message);
    }
}
