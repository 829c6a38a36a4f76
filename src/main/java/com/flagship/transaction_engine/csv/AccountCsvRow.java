package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.transaction_engine.account.Account;
import lombok.Value;

/**
 * One output line. Money columns are rendered with exactly four decimals.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountCsvRow {
    long client;
    String available;
    String held;
    String total;
    boolean locked;

    public static AccountCsvRow from(Account account) {
        return new AccountCsvRow(
            account.getClient(),
            account.getAvailable().toDecimalText(),
            account.getHeld().toDecimalText(),
            account.getTotal().toDecimalText(),
            account.isLocked()
        );
    }
}
