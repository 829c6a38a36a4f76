package com.flagship.transaction_engine.processor;

import com.flagship.transaction_engine.amount.Amount;
import lombok.Value;

/**
 * One typed input event.
 * Amount is present for deposits and withdrawals and null otherwise.
 */
@Value
public class TransactionRecord {
    TransactionType type;
    long client;
    long tx;
    Amount amount;

    public static TransactionRecord deposit(long client, long tx, Amount amount) {
        return new TransactionRecord(TransactionType.DEPOSIT, client, tx, amount);
    }

    public static TransactionRecord withdrawal(long client, long tx, Amount amount) {
        return new TransactionRecord(TransactionType.WITHDRAWAL, client, tx, amount);
    }

    public static TransactionRecord dispute(long client, long tx) {
        return new TransactionRecord(TransactionType.DISPUTE, client, tx, null);
    }

    public static TransactionRecord resolve(long client, long tx) {
        return new TransactionRecord(TransactionType.RESOLVE, client, tx, null);
    }

    public static TransactionRecord chargeback(long client, long tx) {
        return new TransactionRecord(TransactionType.CHARGEBACK, client, tx, null);
    }
}
