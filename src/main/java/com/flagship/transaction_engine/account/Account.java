package com.flagship.transaction_engine.account;

import com.flagship.transaction_engine.amount.Amount;
import com.flagship.transaction_engine.exception.RejectionReason;
import com.flagship.transaction_engine.exception.TransactionRejectedException;
import lombok.Value;

/**
 * Balance state of a single client.
 *
 * Key principles:
 * - Transitions are explicit and validated
 * - A refused transition throws before anything changes
 * - State changes are immutable (each transition returns a new Account)
 *
 * Total is always derived as available + held and never stored.
 * Once locked by a chargeback, deposit and withdraw always fail.
 */
@Value
public class Account {
    long client;
    Amount available;
    Amount held;
    boolean locked;

    /**
     * Creates an empty, unlocked account.
     */
    public static Account open(long client) {
        return new Account(client, Amount.ZERO, Amount.ZERO, false);
    }

    public Amount getTotal() {
        return available.add(held);
    }

    /**
     * Adds funds to available.
     *
     * @throws TransactionRejectedException with ACCOUNT_LOCKED if the account is locked
     */
    public Account deposit(Amount amount) {
        requireUnlocked();
        return new Account(client, available.add(amount), held, false);
    }

    /**
     * Removes funds from available.
     *
     * @throws TransactionRejectedException with ACCOUNT_LOCKED or INSUFFICIENT_FUNDS
     */
    public Account withdraw(Amount amount) {
        requireUnlocked();
        if (available.isLessThan(amount)) {
            throw new TransactionRejectedException(RejectionReason.INSUFFICIENT_FUNDS,
                String.format("Client %d has %s available, cannot withdraw %s", client, available, amount));
        }
        return new Account(client, available.subtract(amount), held, false);
    }

    /**
     * Moves disputed funds from available to held.
     * Available may go negative when the funds were already withdrawn.
     */
    public Account hold(Amount amount) {
        return new Account(client, available.subtract(amount), held.add(amount), locked);
    }

    /**
     * Moves resolved funds from held back to available.
     */
    public Account release(Amount amount) {
        return new Account(client, available.add(amount), held.subtract(amount), locked);
    }

    /**
     * Drops charged back funds from held and freezes the account.
     */
    public Account chargeback(Amount amount) {
        return new Account(client, available, held.subtract(amount), true);
    }

    /**
     * @throws TransactionRejectedException with ACCOUNT_LOCKED if the account is locked
     */
    public void requireUnlocked() {
        if (locked) {
            throw new TransactionRejectedException(RejectionReason.ACCOUNT_LOCKED,
                String.format("Account of client %d is locked", client));
        }
    }
}
