package com.flagship.accounting_ledger.account;

import com.flagship.accounting_ledger.exception.DuplicateAccountException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of the chart of accounts over the {@code accounts} table.
 * Deletes and code/type changes are additionally rejected by database triggers.
 */
@Repository
public class JdbcAccountRepository implements AccountRepository {

    private static final String SELECT_COLUMNS =
        "SELECT code, name, account_type, active, description, created_at FROM accounts ";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JdbcAccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public Account insert(Account account) {
        try {
            jdbcTemplate.update(
                "INSERT INTO accounts (code, name, account_type, active, description, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?)",
                account.getCode(),
                account.getName(),
                account.getType().name(),
                account.isActive(),
                account.getDescription(),
                OffsetDateTime.ofInstant(account.getCreatedAt(), ZoneOffset.UTC)
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateAccountException(account.getCode());
        }
        return account;
    }

    @Override
    public Optional<Account> findByCode(String code) {
        List<Account> accounts = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE code = ?",
            accountRowMapper(),
            code
        );
        return accounts.stream().findFirst();
    }

    @Override
    public List<Account> findAll(AccountType type) {
        if (type == null) {
            return jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY code", accountRowMapper());
        }
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE account_type = ? ORDER BY code",
            accountRowMapper(),
            type.name()
        );
    }

    @Override
    public Map<String, Account> findForPosting(Collection<String> codes) {
        Map<String, Account> result = new LinkedHashMap<>();
        if (codes.isEmpty()) {
            return result;
        }
        // FOR SHARE blocks a concurrent deactivation until this posting commits or rolls back
        List<Account> accounts = namedJdbcTemplate.query(
            SELECT_COLUMNS + "WHERE code IN (:codes) ORDER BY code FOR SHARE",
            new MapSqlParameterSource("codes", codes),
            accountRowMapper()
        );
        accounts.forEach(account -> result.put(account.getCode(), account));
        return result;
    }

    @Override
    public boolean deactivate(String code) {
        int updated = jdbcTemplate.update("UPDATE accounts SET active = FALSE WHERE code = ?", code);
        return updated > 0;
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getString("code"),
            rs.getString("name"),
            AccountType.valueOf(rs.getString("account_type")),
            rs.getBoolean("active"),
            rs.getString("description"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant()
        );
    }
}
