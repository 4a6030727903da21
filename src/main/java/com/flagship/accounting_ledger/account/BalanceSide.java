package com.flagship.accounting_ledger.account;

/**
 * The two sides of a double-entry posting.
 * An account's normal side is the side on which its balance grows.
 */
public enum BalanceSide {
    DEBIT,
    CREDIT;

    /**
     * Signed effect of a line on an account whose normal side is this one.
     */
    public long signedMovement(long debit, long credit) {
        return this == DEBIT
            ? Math.subtractExact(debit, credit)
            : Math.subtractExact(credit, debit);
    }
}
