package com.flagship.transaction_engine.observability;

import com.flagship.transaction_engine.processor.TransactionRecord;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys for log correlation within a run.
 *
 * Every log line of a run carries the run id; lines written while a record
 * is processed also carry its client and tx.
 */
public final class RunContext {

    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String CLIENT_MDC_KEY = "client";
    public static final String TX_MDC_KEY = "tx";

    private RunContext() {
        // Utility class
    }

    /**
     * Starts a run and returns its id. Uses a short format for readability in logs.
     */
    public static String startRun() {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID_MDC_KEY, runId);
        return runId;
    }

    public static void enterRecord(TransactionRecord record) {
        MDC.put(CLIENT_MDC_KEY, String.valueOf(record.getClient()));
        MDC.put(TX_MDC_KEY, String.valueOf(record.getTx()));
    }

    public static void leaveRecord() {
        MDC.remove(CLIENT_MDC_KEY);
        MDC.remove(TX_MDC_KEY);
    }

    /**
     * Clears all run keys. Should be called when the run ends.
     */
    public static void clear() {
        leaveRecord();
        MDC.remove(RUN_ID_MDC_KEY);
    }
}
