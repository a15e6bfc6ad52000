package com.onionwatch.tracker.links.service;

import com.onionwatch.tracker.config.TrackerProperties;
import com.onionwatch.tracker.config.Watchlist;
import com.onionwatch.tracker.links.extract.KeywordMatcher;
import com.onionwatch.tracker.links.extract.PageFeatureExtractor;
import com.onionwatch.tracker.links.http.OnionHttpClient;
import com.onionwatch.tracker.links.model.FilterRecord;
import com.onionwatch.tracker.links.model.FilterRunSummary;
import com.onionwatch.tracker.links.model.HttpFetchResult;
import com.onionwatch.tracker.links.model.PageFeatures;
import com.onionwatch.tracker.links.model.ScanResult;
import com.onionwatch.tracker.links.persistence.FilterJdbcRepository;
import com.onionwatch.tracker.links.persistence.LinkJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Re-fetches every ALIVE address, one at a time, and records the ones whose text mentions a
 * watched keyword.
 */
@Service
public class ContentFilterService {
    private static final Logger log = LoggerFactory.getLogger(ContentFilterService.class);
    private static final Set<String> NON_RETRYABLE_ERRORS = Set.of("invalid_url", "interrupted");

    private final LinkJdbcRepository linkRepository;
    private final FilterJdbcRepository filterRepository;
    private final OnionHttpClient httpClient;
    private final PageFeatureExtractor featureExtractor;
    private final KeywordMatcher keywordMatcher;
    private final TrackerProperties properties;
    private final Clock clock;
    private final RetrySleeper sleeper;

    @Autowired
    public ContentFilterService(
        LinkJdbcRepository linkRepository,
        FilterJdbcRepository filterRepository,
        @Qualifier("filterHttpClient") OnionHttpClient httpClient,
        PageFeatureExtractor featureExtractor,
        Watchlist watchlist,
        TrackerProperties properties,
        Clock clock
    ) {
        this(linkRepository, filterRepository, httpClient, featureExtractor, watchlist, properties, clock, Thread::sleep);
    }

    ContentFilterService(
        LinkJdbcRepository linkRepository,
        FilterJdbcRepository filterRepository,
        OnionHttpClient httpClient,
        PageFeatureExtractor featureExtractor,
        Watchlist watchlist,
        TrackerProperties properties,
        Clock clock,
        RetrySleeper sleeper
    ) {
        this.linkRepository = linkRepository;
        this.filterRepository = filterRepository;
        this.httpClient = httpClient;
        this.featureExtractor = featureExtractor;
        this.keywordMatcher = new KeywordMatcher(
            watchlist.keywords(),
            properties.getFilter().getSnippetBefore(),
            properties.getFilter().getSnippetAfter()
        );
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public FilterRunSummary run() {
        List<String> alive = linkRepository.findAliveAddresses();
        if (keywordMatcher.isEmpty()) {
            log.warn("No keywords configured; pages will be fetched but nothing can match");
        }
        log.info("Scanning {} alive links...", alive.size());

        int matched = 0;
        int failed = 0;
        for (String address : alive) {
            ScanResult result = scan(address);
            if (result.failed()) {
                failed++;
                continue;
            }
            if (!result.hasMatches()) {
                log.debug("No match for {}", address);
                continue;
            }
            try {
                filterRepository.upsert(new FilterRecord(
                    address,
                    result.title(),
                    result.matches(),
                    result.snippet(),
                    clock.instant()
                ));
                matched++;
                log.info("[MATCH] {} | {} | {}", address, result.title(), String.join(", ", result.matches()));
            } catch (DataAccessException e) {
                failed++;
                log.error("DB error for {}: {}", address, e.getMessage(), e);
            }
        }

        int pruned = 0;
        if (properties.getFilter().isPruneStale()) {
            try {
                pruned = filterRepository.deleteAllExcept(alive);
                log.info("Pruned {} filtered links that are no longer alive", pruned);
            } catch (DataAccessException e) {
                log.error("Failed to prune stale filtered links: {}", e.getMessage(), e);
            }
        }

        log.info(
            "Deep filtering completed. Scanned: {}, Matched: {}, Failed: {}",
            alive.size(),
            matched,
            failed
        );
        return new FilterRunSummary(alive.size(), matched, failed, pruned);
    }

    /**
     * Fetches one address and matches its text against the watchlist keywords. Transport failures
     * are retried with a growing delay; a page that cannot be parsed is given up on at once.
     */
    public ScanResult scan(String address) {
        TrackerProperties.Filter filter = properties.getFilter();
        int maxAttempts = filter.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            HttpFetchResult fetch = httpClient.get(address);
            if (fetch.isTransportFailure()) {
                if (NON_RETRYABLE_ERRORS.contains(fetch.errorCode())) {
                    log.warn("[FAIL] {}: {}", address, fetch.errorCode());
                    return ScanResult.failure();
                }
                log.warn("[RETRY {}] {}: {} ({})", attempt, address, fetch.errorCode(), fetch.errorMessage());
                if (attempt < maxAttempts && !sleep(retryDelayMs(filter, attempt))) {
                    return ScanResult.failure();
                }
                continue;
            }
            try {
                return match(fetch.body());
            } catch (RuntimeException e) {
                log.warn("[FAIL] {}: {}", address, e.getMessage());
                return ScanResult.failure();
            }
        }
        log.warn("[FAIL] {}: gave up after {} attempts", address, maxAttempts);
        return ScanResult.failure();
    }

    private ScanResult match(String html) {
        PageFeatures features = featureExtractor.extract(html);
        List<String> matches = keywordMatcher.match(features);
        String snippet = matches.isEmpty() ? "" : keywordMatcher.snippet(features.body(), matches.get(0));
        return ScanResult.of(features.title(), matches, snippet);
    }

    /**
     * Wait before the retry that follows {@code attempt}: the base delay after the first attempt,
     * one increment more after each further attempt.
     */
    static long retryDelayMs(TrackerProperties.Filter filter, int attempt) {
        return filter.getRetryDelayMs() + (long) (attempt - 1) * filter.getRetryIncrementMs();
    }

    private boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @FunctionalInterface
    interface RetrySleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
