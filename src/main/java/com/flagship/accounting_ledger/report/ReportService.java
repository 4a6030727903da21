package com.flagship.accounting_ledger.report;

import com.flagship.accounting_ledger.account.Account;
import com.flagship.accounting_ledger.account.AccountRepository;
import com.flagship.accounting_ledger.account.AccountType;
import com.flagship.accounting_ledger.exception.LedgerIntegrityException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.exception.ValidationFailure;
import com.flagship.accounting_ledger.integrity.LedgerIntegrityMonitor;
import com.flagship.accounting_ledger.journal.AccountTotals;
import com.flagship.accounting_ledger.journal.JournalRepository;
import com.flagship.accounting_ledger.ledger.LedgerQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Financial statements derived from committed journal lines.
 *
 * Each report reads one consistent snapshot. The trial balance and balance sheet identities
 * are asserted on every call; a failure is an integrity violation, not a report outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    private final AccountRepository accountRepository;
    private final JournalRepository journalRepository;
    private final LedgerQueryService ledgerQueryService;
    private final LedgerIntegrityMonitor integrityMonitor;
    private final Clock clock;

    /**
     * @throws LedgerIntegrityException if total debits and total credits differ
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public TrialBalance generateTrialBalance() {
        List<Account> accounts = accountRepository.findAll(null);
        Map<String, AccountTotals> totals = totalsByCode(journalRepository.sumByAccountThrough(null), accounts);

        List<TrialBalance.Line> lines = new ArrayList<>(accounts.size());
        long totalDebits = 0L;
        long totalCredits = 0L;
        for (Account account : accounts) {
            AccountTotals accountTotals = totals.getOrDefault(
                account.getCode(), new AccountTotals(account.getCode(), 0L, 0L));
            totalDebits = Math.addExact(totalDebits, accountTotals.getDebitTotal());
            totalCredits = Math.addExact(totalCredits, accountTotals.getCreditTotal());
            lines.add(new TrialBalance.Line(
                account.getCode(),
                account.getName(),
                account.getType(),
                accountTotals.getDebitTotal(),
                accountTotals.getCreditTotal(),
                account.getNormalBalanceSide().signedMovement(
                    accountTotals.getDebitTotal(), accountTotals.getCreditTotal())
            ));
        }

        if (totalDebits != totalCredits) {
            throw integrityMonitor.recordViolation("Trial balance identity",
                String.format("total debits %d != total credits %d", totalDebits, totalCredits));
        }

        log.debug("Trial balance generated: accounts={}, totalDebits={}", lines.size(), totalDebits);
        return new TrialBalance(List.copyOf(lines), totalDebits, totalCredits, Instant.now(clock));
    }

    /**
     * Revenue and expense movements for entries created in {@code [start, end)}; a null bound
     * is open.
     *
     * @throws ValidationException if both bounds are given and start is not before end
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ProfitLoss generateProfitLoss(Instant start, Instant end) {
        if (start != null && end != null && !start.isBefore(end)) {
            throw new ValidationException(ValidationFailure.INVALID_REQUEST,
                "Start date must be before end date");
        }

        List<Account> accounts = accountRepository.findAll(null);
        Map<String, AccountTotals> totals = totalsByCode(journalRepository.sumByAccountBetween(start, end), accounts);

        List<AccountAmount> revenues = amountsFor(accounts, totals, AccountType.REVENUE);
        List<AccountAmount> expenses = amountsFor(accounts, totals, AccountType.EXPENSE);
        long revenueTotal = sum(revenues);
        long expenseTotal = sum(expenses);

        return new ProfitLoss(start, end, revenueTotal, expenseTotal,
            Math.subtractExact(revenueTotal, expenseTotal), revenues, expenses);
    }

    /**
     * Position including every entry created at or before {@code asOf}; null means all entries.
     *
     * @throws LedgerIntegrityException if assets differ from liabilities + equity + retained earnings
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public BalanceSheet generateBalanceSheet(Instant asOf) {
        List<Account> accounts = accountRepository.findAll(null);
        Map<String, AccountTotals> totals = totalsByCode(journalRepository.sumByAccountThrough(asOf), accounts);

        List<AccountAmount> assetAccounts = amountsFor(accounts, totals, AccountType.ASSET);
        List<AccountAmount> liabilityAccounts = amountsFor(accounts, totals, AccountType.LIABILITY);
        List<AccountAmount> equityAccounts = amountsFor(accounts, totals, AccountType.EQUITY);
        long retainedEarnings = Math.subtractExact(
            sum(amountsFor(accounts, totals, AccountType.REVENUE)),
            sum(amountsFor(accounts, totals, AccountType.EXPENSE)));

        BalanceSheet sheet = new BalanceSheet(
            asOf,
            sum(assetAccounts),
            sum(liabilityAccounts),
            sum(equityAccounts),
            retainedEarnings,
            assetAccounts,
            liabilityAccounts,
            equityAccounts
        );

        if (sheet.getAssets() != sheet.getLiabilitiesAndEquity()) {
            throw integrityMonitor.recordViolation("Balance sheet identity",
                String.format("assets %d != liabilities %d + equity %d + retained earnings %d",
                    sheet.getAssets(), sheet.getLiabilities(), sheet.getEquity(), sheet.getRetainedEarnings()));
        }
        return sheet;
    }

    /**
     * Runs both statement identities and reconciles a full line-by-line replay of the journal
     * against the aggregated per-account totals.
     *
     * @throws LedgerIntegrityException on the first identity that fails
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public IntegrityReport verifyIntegrity() {
        TrialBalance trialBalance = generateTrialBalance();
        BalanceSheet balanceSheet = generateBalanceSheet(null);

        Map<String, Long> replayed = ledgerQueryService.replayBalances();
        for (TrialBalance.Line line : trialBalance.getLines()) {
            Long replayedBalance = replayed.get(line.getAccountCode());
            if (!Objects.equals(replayedBalance, line.getBalance())) {
                throw integrityMonitor.recordViolation("Replay reconciliation",
                    String.format("account %s: replayed balance %s != aggregated balance %d",
                        line.getAccountCode(), replayedBalance, line.getBalance()));
            }
        }

        IntegrityReport report = new IntegrityReport(
            Instant.now(clock),
            trialBalance.getTotalDebits(),
            trialBalance.getTotalCredits(),
            balanceSheet.getAssets(),
            balanceSheet.getLiabilitiesAndEquity(),
            trialBalance.getLines().size(),
            integrityMonitor.isHalted()
        );
        log.info("Ledger integrity verified: accounts={}, totalDebits={}, halted={}",
            report.getAccountsReconciled(), report.getTotalDebits(), report.isHalted());
        return report;
    }

    private Map<String, AccountTotals> totalsByCode(List<AccountTotals> totals, List<Account> accounts) {
        Map<String, AccountTotals> byCode = totals.stream()
            .collect(Collectors.toMap(AccountTotals::getAccountCode, Function.identity()));
        if (!byCode.isEmpty()) {
            Map<String, Account> known = accounts.stream()
                .collect(Collectors.toMap(Account::getCode, Function.identity()));
            for (String code : byCode.keySet()) {
                if (!known.containsKey(code)) {
                    throw integrityMonitor.recordViolation("Chart of accounts",
                        "journal lines reference unknown account " + code);
                }
            }
        }
        return byCode;
    }

    private static List<AccountAmount> amountsFor(List<Account> accounts, Map<String, AccountTotals> totals,
                                                  AccountType type) {
        return accounts.stream()
            .filter(account -> account.getType() == type)
            .map(account -> {
                AccountTotals accountTotals = totals.get(account.getCode());
                long amount = accountTotals == null ? 0L : account.getNormalBalanceSide().signedMovement(
                    accountTotals.getDebitTotal(), accountTotals.getCreditTotal());
                return new AccountAmount(account.getCode(), account.getName(), amount);
            })
            .toList();
    }

    private static long sum(List<AccountAmount> amounts) {
        return amounts.stream().mapToLong(AccountAmount::getAmount).reduce(0L, Math::addExact);
    }
}
