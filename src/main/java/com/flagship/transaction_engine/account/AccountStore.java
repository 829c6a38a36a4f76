package com.flagship.transaction_engine.account;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accounts of one run, in the order their clients were first seen.
 *
 * Created per run and owned by a single processor; not thread-safe.
 */
public class AccountStore {

    private final Map<Long, Account> accounts = new LinkedHashMap<>();

    public Optional<Account> find(long client) {
        return Optional.ofNullable(accounts.get(client));
    }

    /**
     * Stores the new state of an account. A client seen for the first
     * time is appended to the iteration order; replacing keeps its position.
     */
    public void save(Account account) {
        accounts.put(account.getClient(), account);
    }

    /**
     * Immutable copy of all accounts in first-seen order.
     */
    public List<Account> snapshot() {
        return List.copyOf(accounts.values());
    }
}
