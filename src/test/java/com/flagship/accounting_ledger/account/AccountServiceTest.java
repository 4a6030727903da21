package com.flagship.accounting_ledger.account;

import com.flagship.accounting_ledger.audit.AuditAction;
import com.flagship.accounting_ledger.event.AccountCreatedEvent;
import com.flagship.accounting_ledger.event.AccountDeactivatedEvent;
import com.flagship.accounting_ledger.exception.DuplicateAccountException;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.exception.ValidationFailure;
import com.flagship.accounting_ledger.journal.JournalEntryRequest;
import com.flagship.accounting_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Chart of accounts: creation, lookup, listing and retirement.
 */
class AccountServiceTest {

    private LedgerFixture ledger;
    private AccountService accountService;

    @BeforeEach
    void setUp() {
        ledger = new LedgerFixture();
        accountService = ledger.accountService;
    }

    @Test
    @DisplayName("New account is active with normal side derived from its type")
    void testCreateAccountDerivesNormalSide() {
        Account cash = accountService.createAccount("1000", "Cash", "asset");
        Account loan = accountService.createAccount("2000", "Bank loan", "LIABILITY");
        Account owner = accountService.createAccount("3000", "Owner equity", "Equity");
        Account sales = accountService.createAccount("4000", "Sales", "revenue");
        Account rent = accountService.createAccount("5000", "Rent", "expense");

        assertTrue(cash.isActive());
        assertEquals(BalanceSide.DEBIT, cash.getNormalBalanceSide());
        assertEquals(BalanceSide.CREDIT, loan.getNormalBalanceSide());
        assertEquals(BalanceSide.CREDIT, owner.getNormalBalanceSide());
        assertEquals(BalanceSide.CREDIT, sales.getNormalBalanceSide());
        assertEquals(BalanceSide.DEBIT, rent.getNormalBalanceSide());
        assertEquals(LedgerFixture.START, cash.getCreatedAt());
    }

    @Test
    @DisplayName("Account creation writes audit row and outbox event")
    void testCreateAccountSideEffects() {
        accountService.createAccount("1000", "Cash", AccountType.ASSET, "Main till");

        verify(ledger.auditService).record(eq(AuditAction.CREATE_ACCOUNT), eq("Account"), eq("1000"), anyMap());
        verify(ledger.outboxService).saveEvent(eq("Account"), any(AccountCreatedEvent.class));
        assertEquals(1.0, ledger.counter("ledger.accounts.created"));
    }

    @Test
    @DisplayName("Duplicate account code is rejected")
    void testDuplicateCode() {
        accountService.createAccount("1000", "Cash", "ASSET");

        DuplicateAccountException e = assertThrows(DuplicateAccountException.class,
            () -> accountService.createAccount("1000", "Other cash", "ASSET"));
        assertEquals("1000", e.getCode());
        assertEquals(1, ledger.accountRepository.size());
    }

    @Test
    @DisplayName("Unrecognized account type is a validation failure")
    void testUnknownType() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> accountService.createAccount("1000", "Cash", "contra-asset"));

        assertEquals(ValidationFailure.UNKNOWN_ACCOUNT_TYPE, e.getFailure());
        assertEquals(0, ledger.accountRepository.size());
        verify(ledger.auditService, never()).record(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Blank code or name is rejected")
    void testBlankFields() {
        ValidationException blankCode = assertThrows(ValidationException.class,
            () -> accountService.createAccount("  ", "Cash", "ASSET"));
        ValidationException blankName = assertThrows(ValidationException.class,
            () -> accountService.createAccount("1000", null, "ASSET"));

        assertEquals(ValidationFailure.INVALID_REQUEST, blankCode.getFailure());
        assertEquals(ValidationFailure.INVALID_REQUEST, blankName.getFailure());
    }

    @Test
    @DisplayName("Unknown account lookup fails with not found")
    void testGetUnknownAccount() {
        assertThrows(NotFoundException.class, () -> accountService.getAccount("9999"));
    }

    @Test
    @DisplayName("Listing is ordered by code and filterable by type")
    void testListAccounts() {
        accountService.createAccount("4000", "Sales", "REVENUE");
        accountService.createAccount("1000", "Cash", "ASSET");
        accountService.createAccount("1100", "Receivables", "ASSET");

        List<Account> all = accountService.listAccounts(null);
        List<Account> assets = accountService.listAccounts(AccountType.ASSET);

        assertEquals(List.of("1000", "1100", "4000"), all.stream().map(Account::getCode).toList());
        assertEquals(List.of("1000", "1100"), assets.stream().map(Account::getCode).toList());
        assertEquals(all, accountService.listAccounts(null), "Order must be stable between calls");
    }

    @Test
    @DisplayName("Deactivated account stays readable but blocks new postings")
    void testDeactivateAccount() {
        ledger.account("1000", AccountType.ASSET);
        ledger.account("4000", AccountType.REVENUE);

        Account deactivated = accountService.deactivateAccount("1000");
        assertFalse(deactivated.isActive());
        assertFalse(accountService.getAccount("1000").isActive());

        ValidationException e = assertThrows(ValidationException.class,
            () -> ledger.journalService.createJournalEntry("Sale", List.of(
                JournalEntryRequest.Line.debit("1000", 500),
                JournalEntryRequest.Line.credit("4000", 500)), null));
        assertEquals(ValidationFailure.INACTIVE_ACCOUNT, e.getFailure());

        verify(ledger.outboxService).saveEvent(eq("Account"), any(AccountDeactivatedEvent.class));
    }

    @Test
    @DisplayName("Deactivating twice is a no-op")
    void testDeactivateTwice() {
        ledger.account("1000", AccountType.ASSET);

        accountService.deactivateAccount("1000");
        Account again = accountService.deactivateAccount("1000");

        assertFalse(again.isActive());
        verify(ledger.auditService, times(1))
            .record(eq(AuditAction.DEACTIVATE_ACCOUNT), eq("Account"), eq("1000"), anyMap());
    }

    @Test
    @DisplayName("Deactivating an unknown account fails with not found")
    void testDeactivateUnknown() {
        assertThrows(NotFoundException.class, () -> accountService.deactivateAccount("9999"));
    }
}
