package com.flagship.transaction_engine.exception;

/**
 * Why a single transaction record was refused.
 *
 * Every reason is recoverable at record granularity: the record is dropped
 * and processing continues with the next one.
 */
public enum RejectionReason {
    /**
     * Amount missing or not strictly positive on a deposit or withdrawal.
     */
    INVALID_AMOUNT,

    /**
     * Withdrawal for a client that has no account yet.
     */
    UNKNOWN_CLIENT,

    /**
     * Dispute, resolve or chargeback for a transaction id with no recorded deposit.
     */
    UNKNOWN_TRANSACTION,

    /**
     * The referenced deposit belongs to another client.
     */
    CLIENT_MISMATCH,

    /**
     * A deposit or withdrawal reuses a transaction id already seen.
     */
    DUPLICATE_TRANSACTION_ID,

    /**
     * Withdrawal larger than the available funds.
     */
    INSUFFICIENT_FUNDS,

    /**
     * The client's account was frozen by a chargeback.
     */
    ACCOUNT_LOCKED,

    /**
     * The dispute lifecycle does not allow this step from the entry's current state.
     */
    INVALID_STATE_TRANSITION
}
