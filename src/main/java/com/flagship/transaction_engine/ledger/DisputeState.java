package com.flagship.transaction_engine.ledger;

/**
 * Dispute lifecycle of a recorded deposit.
 *
 * Transitions are monotonic:
 * CLEAN -> DISPUTED -> RESOLVED | CHARGED_BACK.
 * An entry never returns to CLEAN once disputed.
 */
public enum DisputeState {
    /**
     * Deposit was applied and never disputed.
     */
    CLEAN,

    /**
     * Deposit is under dispute, its amount is held.
     */
    DISPUTED,

    /**
     * Dispute was resolved in the client's favour. Terminal.
     */
    RESOLVED,

    /**
     * Dispute ended in a chargeback. Terminal, locks the account.
     */
    CHARGED_BACK;

    public boolean canTransitionTo(DisputeState target) {
        return switch (this) {
            case CLEAN -> target == DISPUTED;
            case DISPUTED -> target == RESOLVED || target == CHARGED_BACK;
            case RESOLVED, CHARGED_BACK -> false;
        };
    }
}
