package com.flagship.transaction_engine.ledger;

import com.flagship.transaction_engine.amount.Amount;
import com.flagship.transaction_engine.exception.RejectionReason;
import com.flagship.transaction_engine.exception.TransactionRejectedException;
import lombok.Value;

/**
 * A dispute-eligible deposit and where it stands in the dispute lifecycle.
 */
@Value
public class LedgerEntry {
    long tx;
    long client;
    Amount amount;
    DisputeState state;

    public static LedgerEntry clean(long tx, long client, Amount amount) {
        return new LedgerEntry(tx, client, amount, DisputeState.CLEAN);
    }

    /**
     * @return new entry in the target state
     * @throws TransactionRejectedException with INVALID_STATE_TRANSITION if the lifecycle forbids it
     */
    public LedgerEntry transitionTo(DisputeState target) {
        if (!state.canTransitionTo(target)) {
            throw new TransactionRejectedException(RejectionReason.INVALID_STATE_TRANSITION,
                String.format("Transaction %d cannot move from %s to %s", tx, state, target));
        }
        return new LedgerEntry(tx, client, amount, target);
    }
}
