package com.flagship.accounting_ledger.account;

import com.flagship.accounting_ledger.audit.AuditAction;
import com.flagship.accounting_ledger.audit.AuditService;
import com.flagship.accounting_ledger.event.AccountCreatedEvent;
import com.flagship.accounting_ledger.event.AccountDeactivatedEvent;
import com.flagship.accounting_ledger.exception.DuplicateAccountException;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.exception.ValidationFailure;
import com.flagship.accounting_ledger.observability.AccountingMetrics;
import com.flagship.accounting_ledger.observability.CorrelationContext;
import com.flagship.accounting_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * The chart of accounts.
 *
 * Accounts are created once and never deleted, because historical journal lines keep
 * referring to them. Deactivation only blocks new postings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    static final int MAX_CODE_LENGTH = 50;
    static final int MAX_NAME_LENGTH = 255;

    private static final String AGGREGATE_TYPE = "Account";

    private final AccountRepository accountRepository;
    private final AuditService auditService;
    private final OutboxService outboxService;
    private final AccountingMetrics metrics;
    private final Clock clock;

    /**
     * @throws ValidationException if the type is not one of the five recognized kinds
     * @throws DuplicateAccountException if the code already exists
     */
    @Transactional
    public Account createAccount(String code, String name, String type) {
        return createAccount(code, name, AccountType.fromString(type), null);
    }

    @Transactional
    public Account createAccount(String code, String name, AccountType type, String description) {
        String normalizedCode = requireText(code, "Account code", MAX_CODE_LENGTH);
        String normalizedName = requireText(name, "Account name", MAX_NAME_LENGTH);
        if (type == null) {
            throw new ValidationException(ValidationFailure.UNKNOWN_ACCOUNT_TYPE, "Account type is required");
        }

        Instant createdAt = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
        Account account = accountRepository.insert(new Account(
            normalizedCode, normalizedName, type, true, description, createdAt));

        MDC.put(CorrelationContext.ACCOUNT_CODE_MDC_KEY, account.getCode());
        try {
            auditService.record(AuditAction.CREATE_ACCOUNT, AGGREGATE_TYPE, account.getCode(),
                Map.of("name", account.getName(), "type", type.name()));
            outboxService.saveEvent(AGGREGATE_TYPE, AccountCreatedEvent.from(account));
            metrics.recordAccountCreated();

            log.info("Account created: code={}, type={}, normalBalance={}",
                account.getCode(), type, account.getNormalBalanceSide());
            return account;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_CODE_MDC_KEY);
        }
    }

    /**
     * @throws NotFoundException if no account has this code
     */
    @Transactional(readOnly = true)
    public Account getAccount(String code) {
        return accountRepository.findByCode(code)
            .orElseThrow(() -> NotFoundException.account(code));
    }

    /**
     * Accounts ordered by code; {@code type} may be null for all of them.
     */
    @Transactional(readOnly = true)
    public List<Account> listAccounts(AccountType type) {
        return accountRepository.findAll(type);
    }

    /**
     * Retires an account. Its history stays readable; new postings against it are rejected.
     * Deactivating an already inactive account is a no-op.
     */
    @Transactional
    public Account deactivateAccount(String code) {
        Account account = getAccount(code);
        if (!account.isActive()) {
            log.debug("Account {} already inactive", code);
            return account;
        }

        if (!accountRepository.deactivate(code)) {
            throw NotFoundException.account(code);
        }

        auditService.record(AuditAction.DEACTIVATE_ACCOUNT, AGGREGATE_TYPE, code, Map.of());
        outboxService.saveEvent(AGGREGATE_TYPE, AccountDeactivatedEvent.of(code, Instant.now(clock)));

        log.info("Account deactivated: code={}", code);
        return account.deactivate();
    }

    private static String requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ValidationFailure.INVALID_REQUEST, field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new ValidationException(ValidationFailure.INVALID_REQUEST,
                String.format("%s must be at most %d characters", field, maxLength));
        }
        return trimmed;
    }
}
