package com.flagship.accounting_ledger.exception;

public class NotFoundException extends AccountingException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException account(String code) {
        return new NotFoundException("Account not found: " + code);
    }

    public static NotFoundException journalEntry(long entryId) {
        return new NotFoundException("Journal entry not found: " + entryId);
    }
}
