package com.flagship.accounting_ledger.account;

import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.exception.ValidationFailure;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The five kinds of account in the chart of accounts.
 * Asset and expense accounts are debit-normal; the rest are credit-normal.
 */
public enum AccountType {
    ASSET(BalanceSide.DEBIT),
    LIABILITY(BalanceSide.CREDIT),
    EQUITY(BalanceSide.CREDIT),
    REVENUE(BalanceSide.CREDIT),
    EXPENSE(BalanceSide.DEBIT);

    private final BalanceSide normalBalanceSide;

    AccountType(BalanceSide normalBalanceSide) {
        this.normalBalanceSide = normalBalanceSide;
    }

    public BalanceSide getNormalBalanceSide() {
        return normalBalanceSide;
    }

    /**
     * Parses a type name case-insensitively.
     *
     * @throws ValidationException if the name is not one of the five recognized kinds
     */
    public static AccountType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ValidationFailure.UNKNOWN_ACCOUNT_TYPE, "Account type is required");
        }
        try {
            return AccountType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ValidationFailure.UNKNOWN_ACCOUNT_TYPE,
                String.format("Unrecognized account type '%s', expected one of %s", value,
                    Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "))));
        }
    }
}
