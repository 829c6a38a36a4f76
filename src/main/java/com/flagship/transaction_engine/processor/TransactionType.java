package com.flagship.transaction_engine.processor;

import java.util.Locale;

/**
 * Kind of ledger event. Deposits and withdrawals carry an amount,
 * the dispute lifecycle kinds reference an earlier deposit.
 */
public enum TransactionType {
    DEPOSIT(true),
    WITHDRAWAL(true),
    DISPUTE(false),
    RESOLVE(false),
    CHARGEBACK(false);

    private final boolean carriesAmount;

    TransactionType(boolean carriesAmount) {
        this.carriesAmount = carriesAmount;
    }

    public boolean carriesAmount() {
        return carriesAmount;
    }

    /**
     * Lower-case name as it appears in input files, e.g. "withdrawal".
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TransactionType fromCode(String code) {
        for (TransactionType type : values()) {
            if (type.code().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + code);
    }
}
