package com.flagship.transaction_engine.csv;

import com.flagship.transaction_engine.amount.Amount;
import com.flagship.transaction_engine.amount.AmountFormatException;
import com.flagship.transaction_engine.processor.TransactionRecord;
import com.flagship.transaction_engine.processor.TransactionType;

/**
 * Turns raw CSV rows into typed {@link TransactionRecord}s.
 *
 * Rules:
 * - type is one of deposit, withdrawal, dispute, resolve, chargeback
 * - client and tx are non-negative integers
 * - amount is required for deposit and withdrawal and must be blank otherwise
 */
public final class TransactionRecordMapper {

    private TransactionRecordMapper() {
        // Utility class
    }

    public static TransactionRecord toRecord(TransactionCsvRow row, long rowNumber) {
        TransactionType type = parseType(row.getType(), rowNumber);
        long client = parseId("client", row.getClient(), rowNumber);
        long tx = parseId("tx", row.getTx(), rowNumber);
        Amount amount = parseAmount(type, row.getAmount(), rowNumber);
        return new TransactionRecord(type, client, tx, amount);
    }

    private static TransactionType parseType(String value, long rowNumber) {
        if (isBlank(value)) {
            throw new RecordParseException(rowNumber, "missing transaction type");
        }
        try {
            return TransactionType.fromCode(value.trim());
        } catch (IllegalArgumentException e) {
            throw new RecordParseException(rowNumber, e.getMessage(), e);
        }
    }

    private static long parseId(String column, String value, long rowNumber) {
        if (isBlank(value)) {
            throw new RecordParseException(rowNumber, "missing " + column);
        }
        long id;
        try {
            id = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new RecordParseException(rowNumber, "invalid " + column + " '" + value + "'", e);
        }
        if (id < 0) {
            throw new RecordParseException(rowNumber, column + " must not be negative, got " + id);
        }
        return id;
    }

    private static Amount parseAmount(TransactionType type, String value, long rowNumber) {
        if (!type.carriesAmount()) {
            if (!isBlank(value)) {
                throw new RecordParseException(rowNumber, type.code() + " must not carry an amount");
            }
            return null;
        }
        if (isBlank(value)) {
            throw new RecordParseException(rowNumber, type.code() + " requires an amount");
        }
        try {
            return Amount.fromDecimalText(value);
        } catch (AmountFormatException e) {
            throw new RecordParseException(rowNumber, e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
