package com.flagship.transaction_engine.runner;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.flagship.transaction_engine.account.Account;
import com.flagship.transaction_engine.config.TransactionEngineProperties;
import com.flagship.transaction_engine.csv.AccountSnapshotCsvWriter;
import com.flagship.transaction_engine.csv.RecordParseException;
import com.flagship.transaction_engine.csv.TransactionCsvReader;
import com.flagship.transaction_engine.observability.ProcessingMetrics;
import com.flagship.transaction_engine.observability.RunContext;
import com.flagship.transaction_engine.processor.ProcessingResult;
import com.flagship.transaction_engine.processor.TransactionProcessor;
import com.flagship.transaction_engine.processor.TransactionRecord;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Runs one input through a fresh {@link TransactionProcessor} and writes the final accounts.
 *
 * Skip-and-continue policy: rows that fail to parse and records the processor
 * rejects are logged, counted and dropped. They never appear in the output and
 * never fail the run. Only I/O failures and broken CSV structure abort the run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionFileProcessor {

    private final CsvMapper csvMapper;
    private final AccountSnapshotCsvWriter snapshotWriter;
    private final ProcessingMetrics metrics;
    private final TransactionEngineProperties properties;

    /**
     * Processes a UTF-8 CSV file.
     *
     * @throws IOException if the file cannot be opened or read, or the output cannot be written
     */
    public RunSummary process(Path input, Writer out) throws IOException {
        log.info("Processing transactions from {}", input);
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            return process(reader, out);
        }
    }

    public RunSummary process(Reader input, Writer out) throws IOException {
        RunContext.startRun();
        Timer.Sample sample = metrics.startRun();
        try {
            TransactionProcessor processor = TransactionProcessor.newRun();
            long rows = 0;
            long applied = 0;
            long rejected = 0;
            long unparseable = 0;

            try (TransactionCsvReader records = new TransactionCsvReader(csvMapper, input)) {
                Iterator<TransactionRecord> it = records.iterator();
                while (it.hasNext()) {
                    rows++;
                    TransactionRecord record;
                    try {
                        record = it.next();
                    } catch (RecordParseException e) {
                        unparseable++;
                        metrics.recordUnparseable();
                        logSkipped("Skipping unparseable row: {}", e.getMessage());
                        continue;
                    }
                    if (apply(processor, record)) {
                        applied++;
                    } else {
                        rejected++;
                    }
                }
            }

            List<Account> accounts = processor.snapshot();
            snapshotWriter.write(accounts, out);

            RunSummary summary = new RunSummary(rows, applied, rejected, unparseable, accounts.size());
            log.info("Run finished: {} rows, {} applied, {} rejected, {} unparseable, {} accounts",
                summary.getRowsRead(), summary.getApplied(), summary.getRejected(),
                summary.getUnparseable(), summary.getAccounts());
            return summary;
        } finally {
            metrics.stopRun(sample);
            RunContext.clear();
        }
    }

    private boolean apply(TransactionProcessor processor, TransactionRecord record) {
        RunContext.enterRecord(record);
        try {
            ProcessingResult result = processor.apply(record);
            if (result.isApplied()) {
                metrics.recordApplied(record.getType());
                log.debug("Applied {} {}", record.getType().code(), record.getTx());
                return true;
            }
            metrics.recordRejected(result.getReason());
            logSkipped("Rejected {}: {} ({})", record.getType().code(), result.getReason(), result.getMessage());
            return false;
        } finally {
            RunContext.leaveRecord();
        }
    }

    private void logSkipped(String format, Object... args) {
        if (properties.isLogRejections()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
