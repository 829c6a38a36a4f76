package com.flagship.transaction_engine.processor;

import com.flagship.transaction_engine.account.Account;
import com.flagship.transaction_engine.account.AccountStore;
import com.flagship.transaction_engine.amount.Amount;
import com.flagship.transaction_engine.exception.RejectionReason;
import com.flagship.transaction_engine.exception.TransactionRejectedException;
import com.flagship.transaction_engine.ledger.Ledger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies transaction records, one at a time, against the accounts and
 * the dispute ledger of a single run.
 *
 * State machine per record type:
 * - DEPOSIT    → account.deposit + ledger.recordDeposit (creates the account)
 * - WITHDRAWAL → account.withdraw (account must exist)
 * - DISPUTE    → ledger.dispute + account.hold
 * - RESOLVE    → ledger.resolve + account.release
 * - CHARGEBACK → ledger.chargeback + account.chargeback (locks the account)
 *
 * A record is applied completely or not at all. Rejections are returned as
 * {@link ProcessingResult}; what to do with them is the caller's decision.
 * Not thread-safe: one processor per run.
 */
public class TransactionProcessor {

    private final AccountStore accounts;
    private final Ledger ledger;

    public TransactionProcessor(AccountStore accounts, Ledger ledger) {
        this.accounts = Objects.requireNonNull(accounts);
        this.ledger = Objects.requireNonNull(ledger);
    }

    /**
     * Processor over a fresh, empty store and ledger.
     */
    public static TransactionProcessor newRun() {
        return new TransactionProcessor(new AccountStore(), new Ledger());
    }

    public ProcessingResult apply(TransactionRecord record) {
        Objects.requireNonNull(record, "record");
        try {
            switch (record.getType()) {
                case DEPOSIT -> deposit(record);
                case WITHDRAWAL -> withdraw(record);
                case DISPUTE -> dispute(record);
                case RESOLVE -> resolve(record);
                case CHARGEBACK -> chargeback(record);
            }
            return ProcessingResult.applied(record);
        } catch (TransactionRejectedException e) {
            return ProcessingResult.rejected(record, e.getReason(), e.getMessage());
        }
    }

    /**
     * Immutable view of every account, in the order clients were first seen.
     */
    public List<Account> snapshot() {
        return accounts.snapshot();
    }

    private void deposit(TransactionRecord record) {
        Amount amount = requirePositiveAmount(record);
        Account account = accounts.find(record.getClient())
            .orElseGet(() -> Account.open(record.getClient()));
        // Checked ahead of the ledger write so a locked account leaves no entry behind
        Account updated = account.deposit(amount);
        ledger.recordDeposit(record.getTx(), record.getClient(), amount);
        accounts.save(updated);
    }

    private void withdraw(TransactionRecord record) {
        Amount amount = requirePositiveAmount(record);
        Account account = accounts.find(record.getClient())
            .orElseThrow(() -> new TransactionRejectedException(RejectionReason.UNKNOWN_CLIENT,
                String.format("No account for client %d", record.getClient())));
        Account updated = account.withdraw(amount);
        ledger.recordWithdrawal(record.getTx());
        accounts.save(updated);
    }

    private void dispute(TransactionRecord record) {
        Optional<Account> account = unlockedAccount(record);
        Amount amount = ledger.dispute(record.getTx(), record.getClient());
        accounts.save(existing(account, record).hold(amount));
    }

    private void resolve(TransactionRecord record) {
        Optional<Account> account = unlockedAccount(record);
        Amount amount = ledger.resolve(record.getTx(), record.getClient());
        accounts.save(existing(account, record).release(amount));
    }

    private void chargeback(TransactionRecord record) {
        Optional<Account> account = unlockedAccount(record);
        Amount amount = ledger.chargeback(record.getTx(), record.getClient());
        accounts.save(existing(account, record).chargeback(amount));
    }

    private Optional<Account> unlockedAccount(TransactionRecord record) {
        Optional<Account> account = accounts.find(record.getClient());
        account.ifPresent(Account::requireUnlocked);
        return account;
    }

    // A deposit owned by the client always created the account, so the ledger
    // rejects the record before this can be reached with an empty account.
    private Account existing(Optional<Account> account, TransactionRecord record) {
        return account.orElseThrow(() -> new IllegalStateException(
            String.format("Ledger accepted transaction %d for client %d without an account",
                record.getTx(), record.getClient())));
    }

    private Amount requirePositiveAmount(TransactionRecord record) {
        Amount amount = record.getAmount();
        if (amount == null || !amount.isPositive()) {
            throw new TransactionRejectedException(RejectionReason.INVALID_AMOUNT,
                String.format("%s %d needs a positive amount, got %s",
                    record.getType().code(), record.getTx(), amount));
        }
        return amount;
    }
}
