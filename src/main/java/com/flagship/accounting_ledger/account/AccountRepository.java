package com.flagship.accounting_ledger.account;

import com.flagship.accounting_ledger.exception.DuplicateAccountException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage port for the chart of accounts.
 * There is intentionally no delete operation.
 */
public interface AccountRepository {

    /**
     * @throws DuplicateAccountException if the code is already taken
     */
    Account insert(Account account);

    Optional<Account> findByCode(String code);

    /**
     * Lists accounts ordered by code, optionally restricted to one type.
     */
    List<Account> findAll(AccountType type);

    /**
     * Loads the given accounts for a posting. Implementations must keep the returned rows
     * from being deactivated until the surrounding transaction ends.
     */
    Map<String, Account> findForPosting(Collection<String> codes);

    /**
     * Marks the account inactive. Returns false if no such account exists.
     */
    boolean deactivate(String code);
}
