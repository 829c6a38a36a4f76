package com.flagship.transaction_engine.processor;

import com.flagship.transaction_engine.exception.RejectionReason;
import lombok.Value;

/**
 * Outcome of applying one record. Either applied, or rejected with a
 * reason; a rejected record changed nothing.
 */
@Value
public class ProcessingResult {
    TransactionRecord record;
    RejectionReason reason;
    String message;

    public static ProcessingResult applied(TransactionRecord record) {
        return new ProcessingResult(record, null, null);
    }

    public static ProcessingResult rejected(TransactionRecord record, RejectionReason reason, String message) {
        return new ProcessingResult(record, reason, message);
    }

    public boolean isApplied() {
        return reason == null;
    }

    public boolean isRejected() {
        return reason != null;
    }
}
