package com.flagship.accounting_ledger.journal;

import com.flagship.accounting_ledger.exception.ConflictException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * JDBC implementation of the journal over {@code journal_entries} and {@code journal_lines}.
 *
 * Database-side guarantees backing the application checks:
 * <ul>
 *   <li>a deferred constraint trigger rejects any commit that leaves an entry unbalanced</li>
 *   <li>triggers reject UPDATE and DELETE on both tables</li>
 *   <li>{@code client_ref} and {@code reverses_entry_id} are unique</li>
 *   <li>appends hold a transaction-scoped advisory lock, so ids and timestamps are drawn in commit order</li>
 * </ul>
 */
@Repository
public class JdbcJournalRepository implements JournalRepository {

    // Arbitrary key shared by every journal writer
    private static final long APPEND_LOCK_KEY = 0x4A4F55524E414CL;

    private static final String REVERSAL_CONSTRAINT = "uq_journal_entries_reverses_entry_id";

    private static final String SELECT_ENTRY =
        "SELECT id, description, created_at, client_ref, reverses_entry_id FROM journal_entries ";

    private static final String SELECT_POSTING =
        "SELECT l.entry_id, l.line_number, e.created_at, e.description AS entry_description, " +
        "l.account_code, l.debit, l.credit, l.description AS line_description " +
        "FROM journal_lines l JOIN journal_entries e ON e.id = l.entry_id ";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JdbcJournalRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public void lockForAppend() {
        // Released by PostgreSQL at commit or rollback
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", (RowCallbackHandler) rs -> { }, APPEND_LOCK_KEY);
    }

    @Override
    public Optional<JournalEntry> insertIfAbsent(JournalEntryRequest request, Instant createdAt) {
        List<Long> ids;
        try {
            // ON CONFLICT waits for a concurrent insert of the same client_ref to finish;
            // if that one commits, this statement inserts nothing and returns no row.
            ids = jdbcTemplate.query(
                "INSERT INTO journal_entries (description, created_at, client_ref, reverses_entry_id) " +
                "VALUES (?, ?, ?, ?) ON CONFLICT (client_ref) DO NOTHING RETURNING id",
                (rs, rowNum) -> rs.getLong("id"),
                request.getDescription(),
                toTimestamp(createdAt),
                request.getClientRef(),
                request.getReversesEntryId()
            );
        } catch (DuplicateKeyException e) {
            if (request.getReversesEntryId() != null && mentionsConstraint(e, REVERSAL_CONSTRAINT)) {
                throw new ConflictException(
                    "Journal entry " + request.getReversesEntryId() + " has already been reversed");
            }
            throw e;
        }

        if (ids.isEmpty()) {
            return Optional.empty();
        }
        long entryId = ids.get(0);

        List<JournalLine> lines = new ArrayList<>(request.getLines().size());
        List<Object[]> batch = new ArrayList<>(request.getLines().size());
        int lineNumber = 1;
        for (JournalEntryRequest.Line line : request.getLines()) {
            lines.add(new JournalLine(entryId, lineNumber, line.getAccountCode(),
                line.getDebit(), line.getCredit(), line.getDescription()));
            batch.add(new Object[] {
                entryId, lineNumber, line.getAccountCode(), line.getDebit(), line.getCredit(), line.getDescription()
            });
            lineNumber++;
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO journal_lines (entry_id, line_number, account_code, debit, credit, description) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            batch
        );

        return Optional.of(new JournalEntry(
            entryId,
            request.getDescription(),
            createdAt,
            request.getClientRef(),
            request.getReversesEntryId(),
            List.copyOf(lines)
        ));
    }

    @Override
    public Optional<JournalEntry> findById(long id) {
        return findSingle(SELECT_ENTRY + "WHERE id = ?", id);
    }

    @Override
    public Optional<JournalEntry> findByClientRef(String clientRef) {
        return findSingle(SELECT_ENTRY + "WHERE client_ref = ?", clientRef);
    }

    @Override
    public List<JournalEntry> findRecent(int limit) {
        List<EntryHeader> headers = jdbcTemplate.query(
            SELECT_ENTRY + "ORDER BY id DESC LIMIT ?",
            headerRowMapper(),
            limit
        );
        if (headers.isEmpty()) {
            return List.of();
        }

        Map<Long, List<JournalLine>> linesByEntry = new LinkedHashMap<>();
        headers.forEach(header -> linesByEntry.put(header.id, new ArrayList<>()));
        namedJdbcTemplate.query(
            "SELECT entry_id, line_number, account_code, debit, credit, description FROM journal_lines " +
            "WHERE entry_id IN (:ids) ORDER BY entry_id, line_number",
            new MapSqlParameterSource("ids", linesByEntry.keySet()),
            rs -> {
                JournalLine line = mapLine(rs);
                linesByEntry.get(line.getEntryId()).add(line);
            }
        );

        return headers.stream()
            .map(header -> header.toEntry(linesByEntry.get(header.id)))
            .toList();
    }

    @Override
    public List<LedgerPosting> findPostingsByAccount(String accountCode) {
        return jdbcTemplate.query(
            SELECT_POSTING + "WHERE l.account_code = ? ORDER BY l.entry_id, l.line_number",
            postingRowMapper(),
            accountCode
        );
    }

    @Override
    public AccountTotals totalsForAccount(String accountCode) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit), 0) AS debit_total, COALESCE(SUM(credit), 0) AS credit_total " +
            "FROM journal_lines WHERE account_code = ?",
            (rs, rowNum) -> new AccountTotals(accountCode, rs.getLong("debit_total"), rs.getLong("credit_total")),
            accountCode
        );
    }

    @Override
    public void replayPostings(Consumer<LedgerPosting> consumer) {
        RowMapper<LedgerPosting> mapper = postingRowMapper();
        jdbcTemplate.query(
            SELECT_POSTING + "ORDER BY l.entry_id, l.line_number",
            rs -> {
                consumer.accept(mapper.mapRow(rs, rs.getRow()));
            }
        );
    }

    @Override
    public List<AccountTotals> sumByAccountBetween(Instant fromInclusive, Instant toExclusive) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> conditions = new ArrayList<>();
        if (fromInclusive != null) {
            conditions.add("e.created_at >= :from");
            params.addValue("from", toTimestamp(fromInclusive));
        }
        if (toExclusive != null) {
            conditions.add("e.created_at < :to");
            params.addValue("to", toTimestamp(toExclusive));
        }
        return sumByAccount(conditions, params);
    }

    @Override
    public List<AccountTotals> sumByAccountThrough(Instant asOf) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> conditions = new ArrayList<>();
        if (asOf != null) {
            conditions.add("e.created_at <= :asOf");
            params.addValue("asOf", toTimestamp(asOf));
        }
        return sumByAccount(conditions, params);
    }

    private List<AccountTotals> sumByAccount(List<String> conditions, MapSqlParameterSource params) {
        String where = conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions) + " ";
        return namedJdbcTemplate.query(
            "SELECT l.account_code, COALESCE(SUM(l.debit), 0) AS debit_total, " +
            "COALESCE(SUM(l.credit), 0) AS credit_total " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.entry_id " +
            where +
            "GROUP BY l.account_code ORDER BY l.account_code",
            params,
            (rs, rowNum) -> new AccountTotals(
                rs.getString("account_code"),
                rs.getLong("debit_total"),
                rs.getLong("credit_total")
            )
        );
    }

    private Optional<JournalEntry> findSingle(String sql, Object key) {
        List<EntryHeader> headers = jdbcTemplate.query(sql, headerRowMapper(), key);
        if (headers.isEmpty()) {
            return Optional.empty();
        }
        EntryHeader header = headers.get(0);
        List<JournalLine> lines = jdbcTemplate.query(
            "SELECT entry_id, line_number, account_code, debit, credit, description FROM journal_lines " +
            "WHERE entry_id = ? ORDER BY line_number",
            (rs, rowNum) -> mapLine(rs),
            header.id
        );
        return Optional.of(header.toEntry(lines));
    }

    private RowMapper<EntryHeader> headerRowMapper() {
        return (rs, rowNum) -> new EntryHeader(
            rs.getLong("id"),
            rs.getString("description"),
            toInstant(rs, "created_at"),
            rs.getString("client_ref"),
            (Long) rs.getObject("reverses_entry_id", Long.class)
        );
    }

    private RowMapper<LedgerPosting> postingRowMapper() {
        return (rs, rowNum) -> new LedgerPosting(
            rs.getLong("entry_id"),
            rs.getInt("line_number"),
            toInstant(rs, "created_at"),
            rs.getString("entry_description"),
            rs.getString("account_code"),
            rs.getLong("debit"),
            rs.getLong("credit"),
            rs.getString("line_description")
        );
    }

    private static JournalLine mapLine(ResultSet rs) throws SQLException {
        return new JournalLine(
            rs.getLong("entry_id"),
            rs.getInt("line_number"),
            rs.getString("account_code"),
            rs.getLong("debit"),
            rs.getLong("credit"),
            rs.getString("description")
        );
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, OffsetDateTime.class).toInstant();
    }

    private static boolean mentionsConstraint(DuplicateKeyException e, String constraint) {
        Throwable cause = e;
        while (cause != null) {
            if (cause.getMessage() != null && cause.getMessage().contains(constraint)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private record EntryHeader(long id, String description, Instant createdAt, String clientRef,
                               Long reversesEntryId) {

        JournalEntry toEntry(List<JournalLine> lines) {
            return new JournalEntry(id, description, createdAt, clientRef, reversesEntryId, List.copyOf(lines));
        }
    }
}
