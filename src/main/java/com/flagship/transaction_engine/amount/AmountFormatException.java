package com.flagship.transaction_engine.amount;

/**
 * Thrown when monetary text cannot be turned into an {@link Amount}.
 */
public class AmountFormatException extends IllegalArgumentException {

    public AmountFormatException(String message) {
        super(message);
    }

    public AmountFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
