package com.flagship.accounting_ledger.support;

import com.flagship.accounting_ledger.account.Account;
import com.flagship.accounting_ledger.account.AccountService;
import com.flagship.accounting_ledger.account.AccountType;
import com.flagship.accounting_ledger.audit.AuditService;
import com.flagship.accounting_ledger.integrity.LedgerIntegrityMonitor;
import com.flagship.accounting_ledger.journal.IdempotencyService;
import com.flagship.accounting_ledger.journal.JournalService;
import com.flagship.accounting_ledger.ledger.LedgerQueryService;
import com.flagship.accounting_ledger.observability.AccountingMetrics;
import com.flagship.accounting_ledger.outbox.OutboxService;
import com.flagship.accounting_ledger.report.ReportService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.Mockito.mock;

/**
 * Wires the accounting services over in-memory repositories. Audit and outbox writes are
 * Mockito mocks so tests can verify them without a database.
 */
public class LedgerFixture {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final InMemoryAccountRepository accountRepository = new InMemoryAccountRepository();
    public final InMemoryJournalRepository journalRepository = new InMemoryJournalRepository();
    public final AuditService auditService = mock(AuditService.class);
    public final OutboxService outboxService = mock(OutboxService.class);
    public final AccountingMetrics metrics = new AccountingMetrics(meterRegistry);
    public final LedgerIntegrityMonitor integrityMonitor = new LedgerIntegrityMonitor(meterRegistry, clock);
    public final IdempotencyService idempotencyService =
        new IdempotencyService(journalRepository, Optional.empty(), false);

    public final AccountService accountService =
        new AccountService(accountRepository, auditService, outboxService, metrics, clock);
    public final JournalService journalService = new JournalService(
        journalRepository, accountRepository, idempotencyService, auditService, outboxService,
        integrityMonitor, metrics, clock);
    public final LedgerQueryService ledgerQueryService =
        new LedgerQueryService(accountRepository, journalRepository, integrityMonitor);
    public final ReportService reportService = new ReportService(
        accountRepository, journalRepository, ledgerQueryService, integrityMonitor, clock);

    public Account account(String code, AccountType type) {
        return accountService.createAccount(code, code + " account", type, null);
    }

    public double counter(String name, String... tags) {
        var counter = meterRegistry.find(name).tags(tags).counter();
        return counter == null ? 0.0 : counter.count();
    }
}
