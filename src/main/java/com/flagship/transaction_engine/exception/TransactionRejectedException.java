package com.flagship.transaction_engine.exception;

import lombok.Getter;

/**
 * Thrown by the account and ledger state transitions when a record must be refused.
 *
 * Thrown before any state is touched, so catching it leaves accounts and
 * ledger exactly as they were.
 */
@Getter
public class TransactionRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public TransactionRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
