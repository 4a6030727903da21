package com.flagship.accounting_ledger.support;

import com.flagship.accounting_ledger.exception.ConflictException;
import com.flagship.accounting_ledger.journal.AccountTotals;
import com.flagship.accounting_ledger.journal.JournalEntry;
import com.flagship.accounting_ledger.journal.JournalEntryRequest;
import com.flagship.accounting_ledger.journal.JournalLine;
import com.flagship.accounting_ledger.journal.JournalRepository;
import com.flagship.accounting_ledger.journal.LedgerPosting;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Append-only journal kept in memory. {@link #insertIfAbsent} is atomic under the instance
 * lock, mirroring the single-statement insert of the JDBC implementation.
 */
public class InMemoryJournalRepository implements JournalRepository {

    private final TreeMap<Long, JournalEntry> entries = new TreeMap<>();
    private long nextId = 1;
    private Runnable beforeNextAppend;

    /**
     * Runs {@code action} once, the next time a writer asks for the append lock. Lets a test
     * commit another entry while a posting waits its turn.
     */
    public synchronized void beforeNextAppend(Runnable action) {
        this.beforeNextAppend = action;
    }

    @Override
    public void lockForAppend() {
        Runnable action;
        synchronized (this) {
            action = beforeNextAppend;
            beforeNextAppend = null;
        }
        if (action != null) {
            action.run();
        }
    }

    @Override
    public synchronized Optional<JournalEntry> insertIfAbsent(JournalEntryRequest request, Instant createdAt) {
        if (request.getClientRef() != null && findByClientRef(request.getClientRef()).isPresent()) {
            return Optional.empty();
        }
        if (request.getReversesEntryId() != null && entries.values().stream()
                .anyMatch(entry -> request.getReversesEntryId().equals(entry.getReversesEntryId()))) {
            throw new ConflictException("Journal entry " + request.getReversesEntryId() + " has already been reversed");
        }

        long id = nextId++;
        List<JournalLine> lines = new ArrayList<>();
        int lineNumber = 1;
        for (JournalEntryRequest.Line line : request.getLines()) {
            lines.add(new JournalLine(id, lineNumber++, line.getAccountCode(),
                line.getDebit(), line.getCredit(), line.getDescription()));
        }
        JournalEntry entry = new JournalEntry(id, request.getDescription(), createdAt,
            request.getClientRef(), request.getReversesEntryId(), List.copyOf(lines));
        entries.put(id, entry);
        return Optional.of(entry);
    }

    /**
     * Stores lines without any validation, the way an out-of-band write to the store would.
     */
    public synchronized JournalEntry appendUnchecked(String description, Instant createdAt, JournalLine... lines) {
        long id = nextId++;
        List<JournalLine> renumbered = new ArrayList<>();
        for (JournalLine line : lines) {
            renumbered.add(new JournalLine(id, line.getLineNumber(), line.getAccountCode(),
                line.getDebit(), line.getCredit(), line.getDescription()));
        }
        JournalEntry entry = new JournalEntry(id, description, createdAt, null, null, List.copyOf(renumbered));
        entries.put(id, entry);
        return entry;
    }

    @Override
    public synchronized Optional<JournalEntry> findById(long id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public synchronized Optional<JournalEntry> findByClientRef(String clientRef) {
        return entries.values().stream()
            .filter(entry -> clientRef.equals(entry.getClientRef()))
            .findFirst();
    }

    @Override
    public synchronized List<JournalEntry> findRecent(int limit) {
        return entries.descendingMap().values().stream().limit(limit).toList();
    }

    @Override
    public synchronized List<LedgerPosting> findPostingsByAccount(String accountCode) {
        return postings(entry -> true).stream()
            .filter(posting -> posting.getAccountCode().equals(accountCode))
            .toList();
    }

    @Override
    public synchronized AccountTotals totalsForAccount(String accountCode) {
        long debits = 0;
        long credits = 0;
        for (LedgerPosting posting : findPostingsByAccount(accountCode)) {
            debits += posting.getDebit();
            credits += posting.getCredit();
        }
        return new AccountTotals(accountCode, debits, credits);
    }

    @Override
    public synchronized void replayPostings(Consumer<LedgerPosting> consumer) {
        postings(entry -> true).forEach(consumer);
    }

    @Override
    public synchronized List<AccountTotals> sumByAccountBetween(Instant fromInclusive, Instant toExclusive) {
        return sum(entry -> (fromInclusive == null || !entry.getCreatedAt().isBefore(fromInclusive))
            && (toExclusive == null || entry.getCreatedAt().isBefore(toExclusive)));
    }

    @Override
    public synchronized List<AccountTotals> sumByAccountThrough(Instant asOf) {
        return sum(entry -> asOf == null || !entry.getCreatedAt().isAfter(asOf));
    }

    public synchronized int size() {
        return entries.size();
    }

    private List<AccountTotals> sum(Predicate<JournalEntry> filter) {
        Map<String, long[]> totals = new TreeMap<>();
        for (LedgerPosting posting : postings(filter)) {
            long[] sums = totals.computeIfAbsent(posting.getAccountCode(), code -> new long[2]);
            sums[0] += posting.getDebit();
            sums[1] += posting.getCredit();
        }
        List<AccountTotals> result = new ArrayList<>();
        totals.forEach((code, sums) -> result.add(new AccountTotals(code, sums[0], sums[1])));
        return result;
    }

    private List<LedgerPosting> postings(Predicate<JournalEntry> filter) {
        List<LedgerPosting> postings = new ArrayList<>();
        for (JournalEntry entry : entries.values()) {
            if (!filter.test(entry)) {
                continue;
            }
            entry.getLines().stream()
                .sorted(Comparator.comparingInt(JournalLine::getLineNumber))
                .forEach(line -> postings.add(new LedgerPosting(
                    entry.getId(), line.getLineNumber(), entry.getCreatedAt(), entry.getDescription(),
                    line.getAccountCode(), line.getDebit(), line.getCredit(), line.getDescription())));
        }
        return postings;
    }
}
