package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.config.TrackerProperties;
import com.onionwatch.tracker.links.http.OnionHttpClient;
import com.onionwatch.tracker.links.model.BatchReport;
import com.onionwatch.tracker.links.model.HttpFetchResult;
import com.onionwatch.tracker.links.model.LinkRecord;
import com.onionwatch.tracker.links.model.LinkTransition;
import com.onionwatch.tracker.links.model.VerificationSummary;
import com.onionwatch.tracker.links.persistence.LinkJdbcRepository;
import com.onionwatch.tracker.links.persistence.LinkStoreHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Probes candidate addresses with a fixed pool of workers and records each outcome in the link
 * store.
 *
 * <p>Every candidate is queued before the workers start draining. The caller waits until each queued
 * address has been processed, then sends one shutdown item per worker and joins the pool, so a run
 * never reports completion with addresses left over. A probe is a single request: any response
 * below 500 counts as alive, anything else (including timeouts) as dead, with no retry inside the
 * run.
 */
@Service
public class LivenessVerifierService {
    private static final Logger log = LoggerFactory.getLogger(LivenessVerifierService.class);

    private final OnionHttpClient httpClient;
    private final LinkJdbcRepository repository;
    private final TrackerProperties properties;
    private final Clock clock;

    public LivenessVerifierService(
        @Qualifier("probeHttpClient") OnionHttpClient httpClient,
        LinkJdbcRepository repository,
        TrackerProperties properties,
        Clock clock
    ) {
        this.httpClient = httpClient;
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public VerificationSummary verify(Collection<String> candidates) {
        return verify(candidates, LivenessVerifierService::logBatch);
    }

    VerificationSummary verify(Collection<String> candidates, Consumer<BatchReport> batchSink) {
        Set<String> addresses = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                addresses.add(candidate.trim());
            }
        }
        int workerCount = properties.getVerifier().getWorkerCount();
        Instant startedAt = clock.instant();
        Instant observedAt = startedAt.truncatedTo(ChronoUnit.MILLIS);
        log.info("Spawning {} threads to verify {} URLs...", workerCount, addresses.size());

        BlockingQueue<WorkItem> queue = new LinkedBlockingQueue<>();
        CountDownLatch processed = new CountDownLatch(addresses.size());
        RunCounters counters = new RunCounters();
        ExecutorService pool = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("liveness-worker");
            thread.setDaemon(true);
            return thread;
        });

        BatchProgressReporter reporter = BatchProgressReporter.start(properties.getVerifier().getBatchSize(), batchSink);
        try {
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                pool.submit(() -> workerLoop(workerIndex, queue, processed, observedAt, reporter, counters));
            }
            for (String address : addresses) {
                queue.add(new WorkItem(address));
            }
            awaitCompletion(processed, queue, pool, workerCount);
        } finally {
            if (!pool.isTerminated()) {
                pool.shutdownNow();
            }
            reporter.close();
        }

        log.info("Finished checking. Alive: {}, Dead: {}", counters.alive.get(), counters.dead.get());
        if (counters.storeErrors.get() > 0) {
            log.warn("{} addresses could not be written to the link store", counters.storeErrors.get());
        }
        return counters.toSummary(addresses.size(), reporter.batchesEmitted(), startedAt, clock.instant());
    }

    /**
     * Single best-effort probe. True when a response arrived with a status code below 500.
     */
    public boolean probe(String address) {
        try {
            HttpFetchResult result = httpClient.get(address);
            return result.isResponse() && result.statusCode() < 500;
        } catch (RuntimeException e) {
            log.warn("Probe failed for {}", address, e);
            return false;
        }
    }

    private void awaitCompletion(
        CountDownLatch processed,
        BlockingQueue<WorkItem> queue,
        ExecutorService pool,
        int workerCount
    ) {
        try {
            processed.await();
            for (int i = 0; i < workerCount; i++) {
                queue.add(WorkItem.SHUTDOWN);
            }
            pool.shutdown();
            while (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Waiting for liveness workers to exit...");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for liveness workers; {} addresses unprocessed", processed.getCount());
            pool.shutdownNow();
        }
    }

    private void workerLoop(
        int workerIndex,
        BlockingQueue<WorkItem> queue,
        CountDownLatch processed,
        Instant observedAt,
        BatchProgressReporter reporter,
        RunCounters counters
    ) {
        Thread.currentThread().setName("liveness-worker-" + workerIndex);
        try (LinkStoreHandle handle = openHandle(workerIndex)) {
            while (true) {
                WorkItem item = queue.take();
                if (item.isShutdown()) {
                    return;
                }
                try {
                    process(item.address(), handle, observedAt, reporter, counters);
                } finally {
                    processed.countDown();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private LinkStoreHandle openHandle(int workerIndex) {
        try {
            return repository.openHandle();
        } catch (RuntimeException e) {
            log.error("Liveness worker {} could not open a link store handle", workerIndex, e);
            return null;
        }
    }

    private void process(
        String address,
        LinkStoreHandle handle,
        Instant observedAt,
        BatchProgressReporter reporter,
        RunCounters counters
    ) {
        boolean alive = probe(address);
        if (handle == null) {
            log.error("DB error for {}: no link store handle", address);
            counters.storeErrors.incrementAndGet();
            return;
        }
        try {
            LinkRecord existing = handle.find(address);
            LinkRecord updated = LinkRecord.apply(existing, address, alive, observedAt);
            handle.save(updated);
            counters.record(alive, LinkTransition.between(existing, updated.status()));
            reporter.record(alive);
        } catch (RuntimeException e) {
            log.error("DB error for {}: {}", address, e.getMessage(), e);
            counters.storeErrors.incrementAndGet();
        }
    }

    private static void logBatch(BatchReport report) {
        log.info(
            "Batch {}: {} checked -> {} alive, {} dead",
            report.batchNumber(),
            report.checked(),
            report.alive(),
            report.dead()
        );
    }

    private record WorkItem(String address) {
        private static final WorkItem SHUTDOWN = new WorkItem(null);

        boolean isShutdown() {
            return address == null;
        }
    }

    private static final class RunCounters {
        private final AtomicInteger alive = new AtomicInteger();
        private final AtomicInteger dead = new AtomicInteger();
        private final AtomicInteger storeErrors = new AtomicInteger();
        private final Map<LinkTransition, AtomicInteger> transitions = new ConcurrentHashMap<>();

        void record(boolean isAlive, LinkTransition transition) {
            (isAlive ? alive : dead).incrementAndGet();
            transitions.computeIfAbsent(transition, ignored -> new AtomicInteger()).incrementAndGet();
        }

        VerificationSummary toSummary(int candidates, int batches, Instant startedAt, Instant finishedAt) {
            Map<LinkTransition, Integer> counts = new EnumMap<>(LinkTransition.class);
            transitions.forEach((transition, count) -> counts.put(transition, count.get()));
            return new VerificationSummary(
                candidates,
                alive.get(),
                dead.get(),
                storeErrors.get(),
                batches,
                counts,
                startedAt,
                finishedAt
            );
        }
    }
}
