package com.flagship.accounting_ledger.journal;

import lombok.Value;
import lombok.With;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A journal entry as submitted for posting, before any validation.
 *
 * Invariant enforced by {@link JournalService}: sum of debits equals sum of credits.
 */
@Value
public class JournalEntryRequest {
    String description;
    List<Line> lines;
    @With
    String clientRef;
    Long reversesEntryId;

    public static JournalEntryRequest of(String description, List<Line> lines) {
        return new JournalEntryRequest(description, lines, null, null);
    }

    /**
     * @throws ArithmeticException if the total does not fit in a long
     */
    public long getDebitTotal() {
        return lines.stream().mapToLong(Line::getDebit).reduce(0L, Math::addExact);
    }

    /**
     * @throws ArithmeticException if the total does not fit in a long
     */
    public long getCreditTotal() {
        return lines.stream().mapToLong(Line::getCredit).reduce(0L, Math::addExact);
    }

    /**
     * Same account/debit/credit content as a committed entry, ignoring line order and
     * free-text descriptions. Used to tell an idempotent retry from a conflicting reuse
     * of a client reference.
     */
    public boolean hasSameLinesAs(JournalEntry entry) {
        if (lines == null || lines.size() != entry.getLines().size()
            || lines.stream().anyMatch(Objects::isNull)) {
            return false;
        }
        List<Line> requested = lines.stream().sorted(Line.CONTENT_ORDER).toList();
        List<Line> committed = entry.getLines().stream()
            .map(line -> new Line(line.getAccountCode(), line.getDebit(), line.getCredit(), null))
            .sorted(Line.CONTENT_ORDER)
            .toList();
        for (int i = 0; i < requested.size(); i++) {
            if (!requested.get(i).sameContent(committed.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * A requested debit or credit line. Amounts are minor currency units.
     */
    @Value
    public static class Line {
        static final Comparator<Line> CONTENT_ORDER = Comparator
            .comparing(Line::getAccountCode, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(Line::getDebit)
            .thenComparingLong(Line::getCredit);

        String accountCode;
        long debit;
        long credit;
        String description;

        public static Line debit(String accountCode, long amount) {
            return new Line(accountCode, amount, 0L, null);
        }

        public static Line credit(String accountCode, long amount) {
            return new Line(accountCode, 0L, amount, null);
        }

        boolean sameContent(Line other) {
            return Objects.equals(accountCode, other.accountCode)
                && debit == other.debit
                && credit == other.credit;
        }
    }
}
