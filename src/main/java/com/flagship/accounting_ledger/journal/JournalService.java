package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.account.Account;
import com.flagship.accounting_ledger.account.AccountRepository;
import com.flagship.accounting_ledger.audit.AuditAction;
import com.flagship.accounting_ledger.audit.AuditService;
import com.flagship.accounting_ledger.event.JournalEntryPostedEvent;
import com.flagship.accounting_ledger.exception.ConflictException;
import com.flagship.accounting_ledger.exception.NotFoundException;
import com.flagship.accounting_ledger.exception.ValidationException;
import com.flagship.accounting_ledger.exception.ValidationFailure;
import com.flagship.accounting_ledger.integrity.LedgerIntegrityMonitor;
import com.flagship.accounting_ledger.observability.AccountingMetrics;
import com.flagship.accounting_ledger.observability.CorrelationContext;
import com.flagship.accounting_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The only writer of journal entries.
 *
 * Every posting is validated and committed in one transaction together with its audit row
 * and outbox event. Nothing is ever updated or deleted; corrections are reversing entries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    static final int DEFAULT_LIST_LIMIT = 50;
    static final int MAX_LIST_LIMIT = 500;
    static final int MAX_CLIENT_REF_LENGTH = 255;

    private static final String AGGREGATE_TYPE = "JournalEntry";

    private final JournalRepository journalRepository;
    private final AccountRepository accountRepository;
    private final IdempotencyService idempotencyService;
    private final AuditService auditService;
    private final OutboxService outboxService;
    private final LedgerIntegrityMonitor integrityMonitor;
    private final AccountingMetrics metrics;
    private final Clock clock;

    /**
     * Posts a balanced entry. With a client reference, a retry carrying the same lines returns
     * the entry committed by the first call.
     *
     * @throws ValidationException if the entry breaks a posting rule; nothing is written
     * @throws ConflictException if the client reference was already used with different lines
     */
    @Transactional
    public JournalEntry createJournalEntry(String description, List<JournalEntryRequest.Line> lines,
                                           String clientRef) {
        return post(new JournalEntryRequest(description, lines, clientRef, null)).getEntry();
    }

    /**
     * Same as {@link #createJournalEntry} but also reports whether the entry was created by
     * this call or replayed from an earlier one.
     */
    @Transactional
    public PostingResult post(JournalEntryRequest request) {
        long startTime = System.currentTimeMillis();
        JournalEntryRequest normalized = request.withClientRef(normalizeClientRef(request.getClientRef()));

        Optional<PostingResult> replay = replayIfCommitted(normalized);
        if (replay.isPresent()) {
            return replay.get();
        }
        if (normalized.getClientRef() != null) {
            metrics.recordIdempotencyMiss();
        }

        validate(normalized);

        // Held until commit: the timestamp and the id are both drawn by the next writer in line
        journalRepository.lockForAppend();
        Instant createdAt = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
        Optional<JournalEntry> inserted = journalRepository.insertIfAbsent(normalized, createdAt);
        if (inserted.isEmpty()) {
            // A concurrent call with the same client reference committed first.
            JournalEntry winner = journalRepository.findByClientRef(normalized.getClientRef())
                .orElseThrow(() -> new IllegalStateException(
                    "Client reference reported taken but no entry found: " + normalized.getClientRef()));
            return replayOrConflict(normalized, winner);
        }

        JournalEntry entry = inserted.get();
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, Long.toString(entry.getId()));
        try {
            auditService.record(
                entry.isReversal() ? AuditAction.REVERSE_JOURNAL : AuditAction.POST_JOURNAL,
                AGGREGATE_TYPE,
                Long.toString(entry.getId()),
                auditDetails(entry)
            );
            outboxService.saveEvent(AGGREGATE_TYPE, JournalEntryPostedEvent.from(entry));
            rememberAfterCommit(entry);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEntryPosted(duration);
            log.info("Journal entry posted: id={}, lines={}, amount={}, reverses={}, duration={}ms",
                entry.getId(), entry.getLines().size(), entry.getTotalDebits(),
                entry.getReversesEntryId(), duration);
            return PostingResult.created(entry);
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Posts an entry that exactly negates an earlier one: every line with debit and credit
     * swapped, back-referencing the original.
     *
     * @throws NotFoundException if the original does not exist
     * @throws ConflictException if the original has already been reversed
     * @throws com.flagship.accounting_ledger.exception.LedgerIntegrityException if the ledger is halted
     */
    @Transactional
    public PostingResult reverseJournalEntry(long entryId, String clientRef) {
        integrityMonitor.assertCorrectionsAllowed();

        JournalEntry original = getJournalEntry(entryId);
        List<JournalEntryRequest.Line> lines = new ArrayList<>(original.getLines().size());
        for (JournalLine line : original.getLines()) {
            lines.add(new JournalEntryRequest.Line(
                line.getAccountCode(),
                line.getCredit(),
                line.getDebit(),
                "Reversal of line " + line.getLineNumber()
            ));
        }

        JournalEntryRequest reversal = new JournalEntryRequest(
            "Reversal of journal entry #" + original.getId() + ": " + original.getDescription(),
            lines,
            clientRef,
            original.getId()
        );
        log.info("Reversing journal entry {}", original.getId());
        return post(reversal);
    }

    /**
     * @throws NotFoundException if no entry has this id
     */
    @Transactional(readOnly = true)
    public JournalEntry getJournalEntry(long entryId) {
        return journalRepository.findById(entryId)
            .orElseThrow(() -> NotFoundException.journalEntry(entryId));
    }

    /**
     * Most recent entries first. A null limit means {@value #DEFAULT_LIST_LIMIT}; larger
     * limits are capped at {@value #MAX_LIST_LIMIT}.
     */
    @Transactional(readOnly = true)
    public List<JournalEntry> listJournalEntries(Integer limit) {
        int effective = limit == null ? DEFAULT_LIST_LIMIT : limit;
        if (effective <= 0) {
            throw new ValidationException(ValidationFailure.INVALID_REQUEST, "Limit must be positive");
        }
        return journalRepository.findRecent(Math.min(effective, MAX_LIST_LIMIT));
    }

    private Optional<PostingResult> replayIfCommitted(JournalEntryRequest request) {
        if (request.getClientRef() == null) {
            return Optional.empty();
        }
        return idempotencyService.findExisting(request.getClientRef())
            .map(existing -> replayOrConflict(request, existing));
    }

    private PostingResult replayOrConflict(JournalEntryRequest request, JournalEntry existing) {
        boolean sameContent = request.hasSameLinesAs(existing)
            && Objects.equals(request.getReversesEntryId(), existing.getReversesEntryId());
        if (!sameContent) {
            metrics.recordIdempotencyConflict();
            log.warn("Client reference {} reused with different content (existing entry {})",
                request.getClientRef(), existing.getId());
            throw new ConflictException(
                "Client reference " + request.getClientRef() + " was already used for journal entry "
                    + existing.getId() + " with different lines");
        }
        metrics.recordIdempotencyHit();
        log.debug("Client reference {} already committed as entry {}, returning it",
            request.getClientRef(), existing.getId());
        return PostingResult.replayed(existing);
    }

    /**
     * Runs the posting rules in a fixed order so each request fails with one predictable reason.
     */
    private void validate(JournalEntryRequest request) {
        try {
            if (request.getDescription() == null || request.getDescription().isBlank()) {
                throw new ValidationException(ValidationFailure.INVALID_REQUEST, "Description is required");
            }

            List<JournalEntryRequest.Line> lines = request.getLines();
            if (lines == null || lines.isEmpty()) {
                throw new ValidationException(ValidationFailure.EMPTY_ENTRY,
                    "Journal entry must have at least one line");
            }

            for (int i = 0; i < lines.size(); i++) {
                validateAmounts(lines.get(i), i + 1);
            }

            validateAccounts(lines);

            long debits;
            long credits;
            try {
                debits = request.getDebitTotal();
                credits = request.getCreditTotal();
            } catch (ArithmeticException e) {
                throw new ValidationException(ValidationFailure.INVALID_LINE_AMOUNT,
                    "Journal entry totals exceed the supported range");
            }
            if (debits != credits) {
                throw new ValidationException(ValidationFailure.UNBALANCED_ENTRY,
                    String.format("Journal entry is not balanced: debits=%d, credits=%d", debits, credits));
            }
        } catch (ValidationException e) {
            metrics.recordEntryRejected(e.getFailure().name());
            log.warn("Journal entry rejected: reason={}, message={}", e.getFailure(), e.getMessage());
            throw e;
        }
    }

    private void validateAmounts(JournalEntryRequest.Line line, int lineNumber) {
        if (line == null) {
            throw new ValidationException(ValidationFailure.INVALID_REQUEST, "Line " + lineNumber + " is missing");
        }
        long debit = line.getDebit();
        long credit = line.getCredit();
        if (debit < 0 || credit < 0) {
            throw new ValidationException(ValidationFailure.INVALID_LINE_AMOUNT,
                "Line " + lineNumber + " has a negative amount");
        }
        if (debit > 0 && credit > 0) {
            throw new ValidationException(ValidationFailure.INVALID_LINE_AMOUNT,
                "Line " + lineNumber + " has both a debit and a credit");
        }
        if (debit == 0 && credit == 0) {
            throw new ValidationException(ValidationFailure.INVALID_LINE_AMOUNT,
                "Line " + lineNumber + " has no amount");
        }
    }

    private void validateAccounts(List<JournalEntryRequest.Line> lines) {
        Set<String> codes = new LinkedHashSet<>();
        for (JournalEntryRequest.Line line : lines) {
            if (line.getAccountCode() == null || line.getAccountCode().isBlank()) {
                throw new ValidationException(ValidationFailure.UNKNOWN_ACCOUNT, "Line has no account code");
            }
            codes.add(line.getAccountCode());
        }

        Map<String, Account> accounts = accountRepository.findForPosting(codes);
        for (String code : codes) {
            Account account = accounts.get(code);
            if (account == null) {
                throw new ValidationException(ValidationFailure.UNKNOWN_ACCOUNT, "Account not found: " + code);
            }
            if (!account.isActive()) {
                throw new ValidationException(ValidationFailure.INACTIVE_ACCOUNT, "Account is inactive: " + code);
            }
        }
    }

    private String normalizeClientRef(String clientRef) {
        if (clientRef == null || clientRef.isBlank()) {
            return null;
        }
        String trimmed = clientRef.trim();
        if (trimmed.length() > MAX_CLIENT_REF_LENGTH) {
            throw new ValidationException(ValidationFailure.INVALID_REQUEST,
                "Client reference must be at most " + MAX_CLIENT_REF_LENGTH + " characters");
        }
        return trimmed;
    }

    private void rememberAfterCommit(JournalEntry entry) {
        if (entry.getClientRef() == null) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    idempotencyService.remember(entry.getClientRef(), entry.getId());
                }
            });
        } else {
            idempotencyService.remember(entry.getClientRef(), entry.getId());
        }
    }

    private static Map<String, Object> auditDetails(JournalEntry entry) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("description", entry.getDescription());
        details.put("lines", entry.getLines().size());
        details.put("amount", entry.getTotalDebits());
        if (entry.getClientRef() != null) {
            details.put("clientRef", entry.getClientRef());
        }
        if (entry.getReversesEntryId() != null) {
            details.put("reversesEntryId", entry.getReversesEntryId());
        }
        return details;
    }
}
