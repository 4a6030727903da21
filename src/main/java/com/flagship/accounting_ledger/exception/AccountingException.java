package com.flagship.accounting_ledger.exception;

/**
 * Base type for every failure the accounting core reports to its callers.
 * Unchecked: callers map these at the API boundary, services simply let them propagate.
 */
public abstract class AccountingException extends RuntimeException {

    protected AccountingException(String message) {
        super(message);
    }

    protected AccountingException(String message, Throwable cause) {
        super(message, cause);
    }
}
