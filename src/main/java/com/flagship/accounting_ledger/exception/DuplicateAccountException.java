package com.flagship.accounting_ledger.exception;

import lombok.Getter;

@Getter
public class DuplicateAccountException extends AccountingException {

    private final String code;

    public DuplicateAccountException(String code) {
        super("Account already exists: " + code);
        this.code = code;
    }
}
