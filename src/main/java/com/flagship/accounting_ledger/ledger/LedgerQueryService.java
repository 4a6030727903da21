package com.flagship.accounting_ledger.ledger;

import com.flagship.accounting_ledger.account.Account;
import com.flagship.accounting_ledger.account.AccountRepository;
import com.flagship.accounting_ledger.account.BalanceSide;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.integrity.LedgerIntegrityMonitor;
import com.flagship.accounting_ledger.journal.AccountTotals;
import com.flagship.accounting_ledger.journal.JournalRepository;
import com.flagship.accounting_ledger.journal.LedgerPosting;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only projections of the journal per account.
 *
 * Balances are never stored. They are derived from committed lines on every call, so they
 * cannot drift from the journal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerQueryService {

    private final AccountRepository accountRepository;
    private final JournalRepository journalRepository;
    private final LedgerIntegrityMonitor integrityMonitor;

    /**
     * Lines affecting the account in commit order with a running balance. Inactive accounts
     * are still readable.
     *
     * @throws NotFoundException if the account does not exist
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public AccountLedger getAccountLedger(String accountCode) {
        Account account = accountRepository.findByCode(accountCode)
            .orElseThrow(() -> NotFoundException.account(accountCode));
        BalanceSide side = account.getNormalBalanceSide();

        List<LedgerPosting> postings = journalRepository.findPostingsByAccount(accountCode);
        List<LedgerEntry> entries = new ArrayList<>(postings.size());
        long running = 0L;
        for (LedgerPosting posting : postings) {
            running = Math.addExact(running, side.signedMovement(posting.getDebit(), posting.getCredit()));
            entries.add(new LedgerEntry(
                posting.getEntryId(),
                posting.getLineNumber(),
                posting.getCreatedAt(),
                posting.getEntryDescription(),
                posting.getLineDescription(),
                posting.getDebit(),
                posting.getCredit(),
                running
            ));
        }

        log.debug("Built ledger for account {}: {} lines, balance={}", accountCode, entries.size(), running);
        return new AccountLedger(account, List.copyOf(entries));
    }

    /**
     * Current balance of one account, signed by its normal side, aggregated in the store.
     *
     * @throws NotFoundException if the account does not exist
     */
    @Transactional(readOnly = true)
    public long getAccountBalance(String accountCode) {
        Account account = accountRepository.findByCode(accountCode)
            .orElseThrow(() -> NotFoundException.account(accountCode));
        AccountTotals totals = journalRepository.totalsForAccount(accountCode);
        return account.getNormalBalanceSide().signedMovement(totals.getDebitTotal(), totals.getCreditTotal());
    }

    /**
     * Recomputes every account balance by replaying the whole journal line by line in commit
     * order. Accounts without postings are included with a zero balance.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Map<String, Long> replayBalances() {
        Map<String, Account> accounts = accountRepository.findAll(null).stream()
            .collect(Collectors.toMap(Account::getCode, Function.identity()));
        Map<String, Long> balances = new TreeMap<>();
        accounts.keySet().forEach(code -> balances.put(code, 0L));

        journalRepository.replayPostings(posting -> {
            Account account = accounts.get(posting.getAccountCode());
            if (account == null) {
                throw integrityMonitor.recordViolation("Replay reconciliation",
                    "entry " + posting.getEntryId() + " line " + posting.getLineNumber()
                        + " references unknown account " + posting.getAccountCode());
            }
            long movement = account.getNormalBalanceSide().signedMovement(posting.getDebit(), posting.getCredit());
            balances.merge(posting.getAccountCode(), movement, Math::addExact);
        });
        return balances;
    }
}
