package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.exception.ConflictException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Storage port for the append-only journal.
 *
 * The only write is {@link #insertIfAbsent}; there is no update or delete.
 */
public interface JournalRepository {

    /**
     * Serializes journal appends until the current transaction ends. Taken after validation and
     * before the timestamp is read, so ids and creation times both follow commit order.
     */
    void lockForAppend();

    /**
     * Atomically stores the header and every line of a validated entry and assigns the next id.
     *
     * <p>When the request carries a client reference already held by a committed entry,
     * nothing is written and the result is empty; the check and the insert are one step.
     *
     * @throws ConflictException if the request reverses an entry that has already been reversed
     */
    Optional<JournalEntry> insertIfAbsent(JournalEntryRequest request, Instant createdAt);

    Optional<JournalEntry> findById(long id);

    Optional<JournalEntry> findByClientRef(String clientRef);

    /**
     * Most recent entries first.
     */
    List<JournalEntry> findRecent(int limit);

    /**
     * Lines posted to one account in commit order (entry id, then line number).
     */
    List<LedgerPosting> findPostingsByAccount(String accountCode);

    /**
     * All-time totals for one account; zero totals if nothing was ever posted to it.
     */
    AccountTotals totalsForAccount(String accountCode);

    /**
     * Streams every line of the journal in commit order.
     */
    void replayPostings(Consumer<LedgerPosting> consumer);

    /**
     * Per-account totals for entries created in {@code [fromInclusive, toExclusive)}.
     * A null bound is open.
     */
    List<AccountTotals> sumByAccountBetween(Instant fromInclusive, Instant toExclusive);

    /**
     * Per-account totals for entries created at or before {@code asOf}; null means all entries.
     */
    List<AccountTotals> sumByAccountThrough(Instant asOf);
}
