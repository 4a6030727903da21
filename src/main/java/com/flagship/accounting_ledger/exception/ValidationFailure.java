package com.flagship.accounting_ledger.exception;

/**
 * Reason a request was rejected before anything was written.
 * Journal validation checks run in declaration order of the entry-related values.
 */
public enum ValidationFailure {
    INVALID_REQUEST,
    EMPTY_ENTRY,
    INVALID_LINE_AMOUNT,
    UNKNOWN_ACCOUNT,
    INACTIVE_ACCOUNT,
    UNBALANCED_ENTRY,
    UNKNOWN_ACCOUNT_TYPE
}
