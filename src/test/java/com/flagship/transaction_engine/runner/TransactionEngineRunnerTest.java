package com.flagship.transaction_engine.runner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class TransactionEngineRunnerTest {

    @Mock
    private TransactionFileProcessor fileProcessor;

    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;
    private TransactionEngineRunner runner;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
        runner = new TransactionEngineRunner(fileProcessor,
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Successful run prints the snapshot and exits 0")
    void testSuccess() throws IOException {
        doAnswer(invocation -> {
            Writer out = invocation.getArgument(1);
            out.write("client,available,held,total,locked\n");
            out.flush();
            return new RunSummary(0, 0, 0, 0, 0);
        }).when(fileProcessor).process(eq(Path.of("input.csv")), any(Writer.class));

        runner.run(new DefaultApplicationArguments("input.csv"));

        assertEquals(TransactionEngineRunner.EXIT_OK, runner.getExitCode());
        assertEquals("client,available,held,total,locked\n", stdout.toString(StandardCharsets.UTF_8));
        assertEquals("", stderr.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Unreadable input exits 1 with a message on stderr")
    void testUnreadableInput() throws IOException {
        doThrow(new NoSuchFileException("missing.csv"))
            .when(fileProcessor).process(any(Path.class), any(Writer.class));

        runner.run(new DefaultApplicationArguments("missing.csv"));

        assertEquals(TransactionEngineRunner.EXIT_FATAL, runner.getExitCode());
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("missing.csv"));
        assertEquals("", stdout.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Failure mid-stream exits 1")
    void testMidStreamFailure() throws IOException {
        doThrow(new UncheckedIOException("Failed to read transaction input at row 3", new IOException("boom")))
            .when(fileProcessor).process(any(Path.class), any(Writer.class));

        runner.run(new DefaultApplicationArguments("input.csv"));

        assertEquals(TransactionEngineRunner.EXIT_FATAL, runner.getExitCode());
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("row 3"));
    }

    @Test
    @DisplayName("Missing or extra arguments print usage and exit 2")
    void testUsage() {
        runner.run(new DefaultApplicationArguments());
        assertEquals(TransactionEngineRunner.EXIT_USAGE, runner.getExitCode());

        runner.run(new DefaultApplicationArguments("a.csv", "b.csv"));
        assertEquals(TransactionEngineRunner.EXIT_USAGE, runner.getExitCode());

        assertTrue(stderr.toString(StandardCharsets.UTF_8).startsWith("Usage:"));
        verifyNoInteractions(fileProcessor);
    }
}
