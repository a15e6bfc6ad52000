package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.links.model.BatchReport;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchProgressReporterTest {

    @Test
    void emitsFullBatchesAndFlushesThePartialOneOnClose() {
        List<BatchReport> reports = new CopyOnWriteArrayList<>();
        BatchProgressReporter reporter = BatchProgressReporter.start(3, reports::add);

        reporter.record(true);
        reporter.record(false);
        reporter.record(true);
        reporter.record(true);
        reporter.record(false);
        reporter.close();

        assertThat(reports).containsExactly(
            new BatchReport(1, 3, 2, 1),
            new BatchReport(2, 2, 1, 1)
        );
        assertThat(reporter.batchesEmitted()).isEqualTo(2);
    }

    @Test
    void emptyRunEmitsNothing() {
        List<BatchReport> reports = new CopyOnWriteArrayList<>();
        BatchProgressReporter reporter = BatchProgressReporter.start(5, reports::add);

        reporter.close();

        assertThat(reports).isEmpty();
        assertThat(reporter.batchesEmitted()).isZero();
    }

    @Test
    void countsOutcomesFromManyThreads() throws Exception {
        List<BatchReport> reports = new CopyOnWriteArrayList<>();
        BatchProgressReporter reporter = BatchProgressReporter.start(10, reports::add);
        Thread[] threads = new Thread[4];
        for (int t = 0; t < threads.length; t++) {
            boolean alive = t % 2 == 0;
            threads[t] = new Thread(() -> {
                for (int i = 0; i < 25; i++) {
                    reporter.record(alive);
                }
            });
            threads[t].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        reporter.close();

        assertThat(reports).hasSize(10);
        assertThat(reports.stream().mapToInt(BatchReport::checked).sum()).isEqualTo(100);
        assertThat(reports.stream().mapToInt(BatchReport::alive).sum()).isEqualTo(50);
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThatThrownBy(() -> BatchProgressReporter.start(0, report -> { }))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
