package com.flagship.transaction_engine.runner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Command surface: {@code transaction-engine <input.csv>}.
 *
 * The account snapshot goes to stdout. Exit codes:
 * - 0: the run completed, even if individual records were skipped
 * - 1: fatal failure (input unreadable, broken CSV, output failure)
 * - 2: wrong usage
 */
@Component
@ConditionalOnProperty(name = "transaction-engine.runner.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class TransactionEngineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private final TransactionFileProcessor fileProcessor;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public TransactionEngineRunner(TransactionFileProcessor fileProcessor) {
        this(fileProcessor, System.out, System.err);
    }

    TransactionEngineRunner(TransactionFileProcessor fileProcessor, PrintStream out, PrintStream err) {
        this.fileProcessor = fileProcessor;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> inputs = args.getNonOptionArgs();
        if (inputs.size() != 1) {
            err.println("Usage: transaction-engine <transactions.csv>");
            exitCode = EXIT_USAGE;
            return;
        }

        Path input = Path.of(inputs.get(0));
        Writer stdout = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        try {
            fileProcessor.process(input, stdout);
            exitCode = EXIT_OK;
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to process input {}: {}", input, e.getMessage(), e);
            err.println("Failed to process input " + input + ": " + e.getMessage());
            exitCode = EXIT_FATAL;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
