package com.flagship.transaction_engine.ledger;

import com.flagship.transaction_engine.amount.Amount;
import com.flagship.transaction_engine.exception.RejectionReason;
import com.flagship.transaction_engine.exception.TransactionRejectedException;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Record of dispute-eligible deposits keyed by transaction id.
 *
 * Withdrawal ids are remembered only to keep transaction ids unique;
 * withdrawals cannot be disputed.
 *
 * Every operation validates first and writes last, so a rejected call
 * leaves the ledger untouched.
 */
public class Ledger {

    private final Map<Long, LedgerEntry> deposits = new HashMap<>();
    private final Set<Long> withdrawals = new HashSet<>();

    /**
     * Records a deposit in CLEAN state.
     *
     * @throws TransactionRejectedException with DUPLICATE_TRANSACTION_ID if the id is taken
     */
    public LedgerEntry recordDeposit(long tx, long client, Amount amount) {
        requireUnusedId(tx);
        LedgerEntry entry = LedgerEntry.clean(tx, client, amount);
        deposits.put(tx, entry);
        return entry;
    }

    /**
     * Reserves a withdrawal id.
     *
     * @throws TransactionRejectedException with DUPLICATE_TRANSACTION_ID if the id is taken
     */
    public void recordWithdrawal(long tx) {
        requireUnusedId(tx);
        withdrawals.add(tx);
    }

    /**
     * Opens a dispute on a CLEAN deposit.
     *
     * @return the disputed amount, to be held on the account
     */
    public Amount dispute(long tx, long client) {
        return transition(tx, client, DisputeState.DISPUTED);
    }

    /**
     * Resolves a DISPUTED deposit.
     *
     * @return the amount to release back to available
     */
    public Amount resolve(long tx, long client) {
        return transition(tx, client, DisputeState.RESOLVED);
    }

    /**
     * Charges back a DISPUTED deposit.
     *
     * @return the amount to remove from held
     */
    public Amount chargeback(long tx, long client) {
        return transition(tx, client, DisputeState.CHARGED_BACK);
    }

    public Optional<LedgerEntry> find(long tx) {
        return Optional.ofNullable(deposits.get(tx));
    }

    public boolean isUsed(long tx) {
        return deposits.containsKey(tx) || withdrawals.contains(tx);
    }

    private Amount transition(long tx, long client, DisputeState target) {
        LedgerEntry entry = deposits.get(tx);
        if (entry == null) {
            throw new TransactionRejectedException(RejectionReason.UNKNOWN_TRANSACTION,
                String.format("No disputable deposit with transaction id %d", tx));
        }
        if (entry.getClient() != client) {
            throw new TransactionRejectedException(RejectionReason.CLIENT_MISMATCH,
                String.format("Transaction %d belongs to client %d, not %d", tx, entry.getClient(), client));
        }
        LedgerEntry next = entry.transitionTo(target);
        deposits.put(tx, next);
        return next.getAmount();
    }

    private void requireUnusedId(long tx) {
        if (isUsed(tx)) {
            throw new TransactionRejectedException(RejectionReason.DUPLICATE_TRANSACTION_ID,
                String.format("Transaction id %d was already used", tx));
        }
    }
}
