package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.links.model.BatchReport;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Aggregates verifier outcomes into fixed-size batches.
 *
 * <p>Workers only enqueue outcomes; a single aggregator thread owns the running counts, emits a
 * {@link BatchReport} every {@code batchSize} outcomes and flushes the partial batch on
 * {@link #close()}.
 */
public class BatchProgressReporter implements AutoCloseable {
    private enum Outcome { ALIVE, DEAD, STOP }

    private final BlockingQueue<Outcome> channel = new LinkedBlockingQueue<>();
    private final int batchSize;
    private final Consumer<BatchReport> sink;
    private final Thread aggregator;

    // Owned by the aggregator thread.
    private int checked;
    private int alive;
    private int dead;
    private volatile int batchNumber;

    private BatchProgressReporter(int batchSize, Consumer<BatchReport> sink, String threadName) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1 but was " + batchSize);
        }
        this.batchSize = batchSize;
        this.sink = sink;
        this.aggregator = new Thread(this::drain, threadName);
        this.aggregator.setDaemon(true);
    }

    public static BatchProgressReporter start(int batchSize, Consumer<BatchReport> sink) {
        BatchProgressReporter reporter = new BatchProgressReporter(batchSize, sink, "verifier-batch-reporter");
        reporter.aggregator.start();
        return reporter;
    }

    public void record(boolean isAlive) {
        channel.add(isAlive ? Outcome.ALIVE : Outcome.DEAD);
    }

    /**
     * Stops the aggregator after it has drained every queued outcome.
     */
    @Override
    public void close() {
        channel.add(Outcome.STOP);
        try {
            aggregator.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Number of batches emitted so far. Exact once {@link #close()} has returned.
     */
    public int batchesEmitted() {
        return batchNumber;
    }

    private void drain() {
        while (true) {
            Outcome outcome;
            try {
                outcome = channel.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                flush();
                return;
            }
            if (outcome == Outcome.STOP) {
                flush();
                return;
            }
            checked++;
            if (outcome == Outcome.ALIVE) {
                alive++;
            } else {
                dead++;
            }
            if (checked >= batchSize) {
                flush();
            }
        }
    }

    private void flush() {
        if (checked == 0) {
            return;
        }
        batchNumber++;
        BatchReport report = new BatchReport(batchNumber, checked, alive, dead);
        checked = 0;
        alive = 0;
        dead = 0;
        sink.accept(report);
    }
}
