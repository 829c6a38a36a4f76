package com.flagship.transaction_engine.observability;

import com.flagship.transaction_engine.exception.RejectionReason;
import com.flagship.transaction_engine.processor.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics for record processing.
 *
 * Metrics exposed:
 * - transactions.applied: Counter of applied records, tagged by type
 * - transactions.rejected: Counter of rejected records, tagged by reason
 * - transactions.unparseable: Counter of rows that could not be parsed
 * - transactions.run.duration: Timer for whole file runs
 */
@Component
public class ProcessingMetrics {

    private final MeterRegistry registry;

    private final Counter unparseable;
    private final Timer runTimer;

    public ProcessingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.unparseable = Counter.builder("transactions.unparseable")
                .description("Number of input rows that could not be parsed")
                .register(registry);

        this.runTimer = Timer.builder("transactions.run.duration")
                .description("Time taken to process one input file")
                .register(registry);
    }

    public void recordApplied(TransactionType type) {
        registry.counter("transactions.applied", "type", type.code()).increment();
    }

    public void recordRejected(RejectionReason reason) {
        registry.counter("transactions.rejected", "reason", reason.name()).increment();
    }

    public void recordUnparseable() {
        unparseable.increment();
    }

    public Timer.Sample startRun() {
        return Timer.start(registry);
    }

    public void stopRun(Timer.Sample sample) {
        sample.stop(runTimer);
    }

    public double appliedCount(TransactionType type) {
        Counter counter = registry.find("transactions.applied").tag("type", type.code()).counter();
        return counter != null ? counter.count() : 0.0;
    }

    public double rejectedCount(RejectionReason reason) {
        Counter counter = registry.find("transactions.rejected").tag("reason", reason.name()).counter();
        return counter != null ? counter.count() : 0.0;
    }

    public double unparseableCount() {
        return unparseable.count();
    }
}
