package com.flagship.accounting_ledger.audit;

public enum AuditAction {
    CREATE_ACCOUNT,
    DEACTIVATE_ACCOUNT,
    POST_JOURNAL,
    REVERSE_JOURNAL
}
