package com.flagship.transaction_engine.csv;

import lombok.Getter;

/**
 * A single input row could not be turned into a transaction record.
 * The row is skipped; the rest of the input is still readable.
 */
@Getter
public class RecordParseException extends RuntimeException {

    private final long row;

    public RecordParseException(long row, String message) {
        super(String.format("Row %d: %s", row, message));
        this.row = row;
    }

    public RecordParseException(long row, String message, Throwable cause) {
        super(String.format("Row %d: %s", row, message), cause);
        this.row = row;
    }
}
