package com.flagship.accounting_ledger.exception;

/**
 * A ledger-wide identity does not hold. This is never a business outcome: it means the
 * journal writer has a bug or the store was modified out of band. Operators must be alerted.
 */
public class LedgerIntegrityException extends AccountingException {

    public LedgerIntegrityException(String message) {
        super(message);
    }
}
